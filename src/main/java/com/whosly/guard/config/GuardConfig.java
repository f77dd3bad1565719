package com.whosly.guard.config;

import com.whosly.guard.access.DataAccessGrantStore;
import com.whosly.guard.access.DataAccessService;
import com.whosly.guard.access.PermissionCatalog;
import com.whosly.guard.access.QueryAccessValidator;
import com.whosly.guard.access.RuleBasedGrantStore;
import com.whosly.guard.access.SystemObjectReconciler;
import com.whosly.guard.parser.DruidSqlParser;
import com.whosly.guard.parser.SqlDialect;
import com.whosly.guard.parser.SqlParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

@Configuration
public class GuardConfig {

    // grammar used for the primary parse
    @Value("${guard.sql-dialect:mysql}")
    private String sqlDialect;

    // database for unqualified table names
    @Value("${guard.default-database:default}")
    private String defaultDatabase;

    @Value("${guard.permissions.read:table:select,query:execute,database:view,table:view}")
    private String[] readPermissions;

    @Value("${guard.permissions.write:table:insert,table:update,table:delete,query:execute:dml}")
    private String[] writePermissions;

    @Value("${guard.permissions.admin:table:create,table:alter,table:drop,database:create,database:drop,query:execute:ddl}")
    private String[] adminPermissions;

    // allow queries on system metadata databases without an explicit rule
    @Value("${guard.grants.system-databases-allowed:true}")
    private boolean systemDatabasesAllowed;

    @Bean
    public SqlParser sqlParser() {
        return new DruidSqlParser(SqlDialect.fromName(sqlDialect));
    }

    @Bean
    public PermissionCatalog permissionCatalog() {
        return new PermissionCatalog(Arrays.asList(readPermissions), Arrays.asList(writePermissions),
                Arrays.asList(adminPermissions));
    }

    @Bean
    @ConditionalOnMissingBean(DataAccessGrantStore.class)
    public DataAccessGrantStore dataAccessGrantStore() {
        return new RuleBasedGrantStore(systemDatabasesAllowed);
    }

    @Bean
    public SystemObjectReconciler systemObjectReconciler() {
        return new SystemObjectReconciler();
    }

    @Bean
    public QueryAccessValidator queryAccessValidator(SqlParser sqlParser, PermissionCatalog permissionCatalog,
                                                     DataAccessGrantStore dataAccessGrantStore,
                                                     SystemObjectReconciler systemObjectReconciler) {
        return new QueryAccessValidator(sqlParser, permissionCatalog, dataAccessGrantStore, systemObjectReconciler);
    }

    @Bean
    public DataAccessService dataAccessService(SqlParser sqlParser, DataAccessGrantStore dataAccessGrantStore) {
        return new DataAccessService(sqlParser, dataAccessGrantStore);
    }

    public String getSqlDialect() {
        return sqlDialect;
    }

    public String getDefaultDatabase() {
        return defaultDatabase;
    }

    public boolean isSystemDatabasesAllowed() {
        return systemDatabasesAllowed;
    }
}
