package com.whosly.guard;

import com.whosly.guard.access.AccessType;
import com.whosly.guard.access.PermissionCatalog;
import com.whosly.guard.config.GuardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;

/**
 * Main application class for the SQL Access Guard.
 * 
 * The guard splits submitted SQL batches into statements, works out what each
 * statement does and touches, and decides whether the caller may run it.
 */
@SpringBootApplication
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    @Autowired
    private GuardConfig guardConfig;

    @Autowired
    private PermissionCatalog permissionCatalog;

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
        log.info("SQL Access Guard started successfully");
    }

    @EventListener
    public void onApplicationEvent(ContextRefreshedEvent event) {
        logInfo();
    }

    private void logInfo() {
        log.info("Access Guard Info:");
        log.info("  SQL dialect: {}", guardConfig.getSqlDialect());
        log.info("  Default database: {}", guardConfig.getDefaultDatabase());
        log.info("  System databases allowed without rules: {}", guardConfig.isSystemDatabasesAllowed());
        log.info("Permission families:");
        log.info("  read: {}", permissionCatalog.getFamily(AccessType.READ));
        log.info("  write: {}", permissionCatalog.getFamily(AccessType.WRITE));
        log.info("  admin: {}", permissionCatalog.getFamily(AccessType.ADMIN));
    }
}
