package com.deskpilot;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.deskpilot.vector.InMemoryVectorIndex;
import com.deskpilot.vector.VectorIndex;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.mongodb.core.MongoTemplate;

class DeskpilotApplicationTest {

    @SuppressWarnings("unchecked")
    private final ObjectProvider<MongoTemplate> mongoProvider = mock(ObjectProvider.class);

    @Test
    void shouldSelectInMemoryIndexWhenConfigured() {
        VectorIndex index = new DeskpilotApplication().vectorIndex(mongoProvider, " Memory ");

        assertInstanceOf(InMemoryVectorIndex.class, index);
        verifyNoInteractions(mongoProvider);
    }

    @Test
    void shouldRejectUnknownStore() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new DeskpilotApplication().vectorIndex(mongoProvider, "cassandra"));

        assertTrue(ex.getMessage().contains("cassandra"));
    }
}
