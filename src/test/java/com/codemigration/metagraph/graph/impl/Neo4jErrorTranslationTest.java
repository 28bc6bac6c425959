package com.codemigration.metagraph.graph.impl;

import com.codemigration.metagraph.exception.ConstraintViolationException;
import com.codemigration.metagraph.exception.MigrationException;
import com.codemigration.metagraph.exception.TransientStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.TransientException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Neo4j Error Translation Tests")
class Neo4jErrorTranslationTest {

    @Test
    @DisplayName("Should treat unavailable and transient server errors as retryable")
    void testTranslate_TransientErrors() {
        MigrationException unavailable = Neo4jGraphStore.translate("applyBatch",
            new ServiceUnavailableException("connection refused"));
        MigrationException deadlock = Neo4jGraphStore.translate("applyBatch",
            new TransientException("Neo.TransientError.Transaction.DeadlockDetected", "deadlock"));

        assertInstanceOf(TransientStoreException.class, unavailable);
        assertInstanceOf(TransientStoreException.class, deadlock);
        assertTrue(unavailable.getMessage().contains("applyBatch"));
    }

    @Test
    @DisplayName("Should report constraint and syntax failures as non-retryable")
    void testTranslate_ClientErrors() {
        MigrationException duplicate = Neo4jGraphStore.translate("applyBatch",
            new ClientException("Neo.ClientError.Schema.ConstraintValidationFailed", "already exists"));
        MigrationException syntax = Neo4jGraphStore.translate("findNodes",
            new ClientException("Neo.ClientError.Statement.SyntaxError", "bad cypher"));

        assertInstanceOf(ConstraintViolationException.class, duplicate);
        assertTrue(duplicate.getMessage().startsWith("Constraint violated"));
        assertInstanceOf(ConstraintViolationException.class, syntax);
        assertTrue(syntax.getMessage().contains("bad cypher"));
    }
}
