package com.whosly.guard.config;

import com.whosly.guard.access.AccessType;
import com.whosly.guard.access.DataAccessGrantStore;
import com.whosly.guard.access.PermissionCatalog;
import com.whosly.guard.access.Principal;
import com.whosly.guard.access.QueryAccessValidator;
import com.whosly.guard.access.RuleBasedGrantStore;
import com.whosly.guard.parser.DruidSqlParser;
import com.whosly.guard.parser.SqlDialect;
import com.whosly.guard.parser.SqlParser;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GuardConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(GuardConfig.class);

    @Test
    void testDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(QueryAccessValidator.class);
            assertThat(context.getBean(GuardConfig.class).getDefaultDatabase()).isEqualTo("default");
            assertThat(((DruidSqlParser) context.getBean(SqlParser.class)).getDialect()).isEqualTo(SqlDialect.MYSQL);
            assertThat(context.getBean(PermissionCatalog.class).getFamily(AccessType.READ))
                    .containsExactlyInAnyOrderElementsOf(PermissionCatalog.DEFAULT_READ_PERMISSIONS);
            assertThat(context.getBean(DataAccessGrantStore.class)).isInstanceOf(RuleBasedGrantStore.class);
        });
    }

    @Test
    void testCustomProperties() {
        contextRunner
                .withPropertyValues("guard.sql-dialect=clickhouse", "guard.permissions.read=read,select",
                        "guard.grants.system-databases-allowed=false")
                .run(context -> {
                    assertThat(((DruidSqlParser) context.getBean(SqlParser.class)).getDialect())
                            .isEqualTo(SqlDialect.CLICKHOUSE);
                    assertThat(context.getBean(PermissionCatalog.class).getFamily(AccessType.READ))
                            .containsExactly("read", "select");
                    assertThat(context.getBean(GuardConfig.class).isSystemDatabasesAllowed()).isFalse();
                    assertThat(context.getBean(DataAccessGrantStore.class)
                            .check("u1", "system", "query_log", AccessType.READ, null).isAllowed()).isFalse();
                });
    }

    @Test
    void testGrantStoreCanBeReplaced() {
        DataAccessGrantStore external = mock(DataAccessGrantStore.class);

        contextRunner
                .withBean(DataAccessGrantStore.class, () -> external)
                .run(context -> {
                    assertThat(context.getBean(DataAccessGrantStore.class)).isSameAs(external);
                    assertThat(context.getBean(QueryAccessValidator.class)
                            .validateQueryAccess(Principal.user("u1", List.of("table:select")), "SELECT * FROM db.t",
                                    null, null)
                            .isAllowed()).isFalse();
                });
    }

    @Test
    void testUnsupportedDialectFailsStartup() {
        contextRunner
                .withPropertyValues("guard.sql-dialect=oracle")
                .run(context -> assertThat(context).hasFailed());
    }
}
