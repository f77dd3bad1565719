package com.whosly.guard.access;

import com.whosly.guard.parser.OperationKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AccessTypeTest {

    @Test
    void testSelectMapsToRead() {
        assertThat(AccessType.forOperation(OperationKind.SELECT)).isEqualTo(AccessType.READ);
    }

    @Test
    void testDmlMapsToWrite() {
        assertThat(AccessType.forOperation(OperationKind.INSERT)).isEqualTo(AccessType.WRITE);
        assertThat(AccessType.forOperation(OperationKind.UPDATE)).isEqualTo(AccessType.WRITE);
        assertThat(AccessType.forOperation(OperationKind.DELETE)).isEqualTo(AccessType.WRITE);
    }

    @Test
    void testDdlMapsToAdmin() {
        assertThat(AccessType.forOperation(OperationKind.CREATE)).isEqualTo(AccessType.ADMIN);
        assertThat(AccessType.forOperation(OperationKind.DROP)).isEqualTo(AccessType.ADMIN);
        assertThat(AccessType.forOperation(OperationKind.ALTER)).isEqualTo(AccessType.ADMIN);
        assertThat(AccessType.forOperation(OperationKind.TRUNCATE)).isEqualTo(AccessType.ADMIN);
    }

    @Test
    void testEverythingElseIsMisc() {
        for (OperationKind kind : new OperationKind[]{OperationKind.SHOW, OperationKind.DESCRIBE, OperationKind.USE,
                OperationKind.SET, OperationKind.EXPLAIN, OperationKind.EXISTS, OperationKind.CHECK,
                OperationKind.KILL, OperationKind.UNKNOWN}) {
            assertThat(AccessType.forOperation(kind)).as(kind.getName()).isEqualTo(AccessType.MISC);
        }
        assertThat(AccessType.forOperation(null)).isEqualTo(AccessType.MISC);
    }

    @Test
    void testNames() {
        assertThat(AccessType.ADMIN.getName()).isEqualTo("admin");
        assertThat(OperationKind.DROP.getName()).isEqualTo("drop");
        assertThat(OperationKind.fromLeadingKeyword("with")).isEqualTo(OperationKind.SELECT);
        assertThat(OperationKind.fromLeadingKeyword("OPTIMIZE")).isEqualTo(OperationKind.UNKNOWN);
    }
}
