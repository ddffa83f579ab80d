package com.entity.consolidation.merge;

import com.entity.consolidation.store.DatabaseConnection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for MergeTransaction commit and rollback handling.
 */
@ExtendWith(MockitoExtension.class)
class MergeTransactionTest {

    @Mock
    private DatabaseConnection connection;

    @Test
    void committedTransaction_noRollback() throws SQLException {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = MergeTransaction.begin(connection)) {
            tx.execute("step1", () -> log.add("op1"));
            tx.execute("step2", () -> log.add("op2"));
            tx.commit();
            assertTrue(tx.isCommitted());
        }

        assertEquals(List.of("op1", "op2"), log);
        InOrder order = inOrder(connection);
        order.verify(connection).beginTransaction();
        order.verify(connection).commit();
        verify(connection, never()).rollback();
    }

    @Test
    void failedStep_propagatesAndRollsBackOnClose() throws SQLException {
        SQLException failure = new SQLException("constraint failed", "23000", 19);

        SQLException thrown = assertThrows(SQLException.class, () -> {
            try (MergeTransaction tx = MergeTransaction.begin(connection)) {
                tx.execute("step1", () -> 1);
                tx.execute("step2", () -> {
                    throw failure;
                });
                tx.commit();
            }
        });

        assertSame(failure, thrown);
        verify(connection).rollback();
        verify(connection, never()).commit();
    }

    @Test
    void closedWithoutCommit_rollsBack() throws SQLException {
        MergeTransaction tx = MergeTransaction.begin(connection);
        tx.execute("step1", () -> 1);
        tx.close();
        tx.close();

        verify(connection).rollback();
    }

    @Test
    void stepsAfterCommitAreRejected() throws SQLException {
        MergeTransaction tx = MergeTransaction.begin(connection);
        tx.commit();

        assertThrows(IllegalStateException.class, () -> tx.execute("late", () -> 1));
        assertThrows(IllegalStateException.class, tx::commit);
    }
}
