package com.lifter.resolution.store;

import com.lifter.resolution.core.model.Lifter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CandidateLookupTest {

    @Mock
    private LifterRepository repository;

    private CandidateLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new CandidateLookup(repository);
    }

    @Test
    @DisplayName("Should return the single holder of a stable id")
    void testSingleHolder() {
        Lifter owner = Lifter.builder().lifterId(10L).normalizedName("Jane Smith").stableId(555L).build();
        when(repository.findByStableId(555L)).thenReturn(List.of(owner));

        assertEquals(List.of(owner), lookup.findByStableId(555L));
        assertTrue(lookup.isStableIdTaken(555L));
    }

    @Test
    @DisplayName("Should return every holder when the id is duplicated")
    void testDuplicateHolders() {
        Lifter a = Lifter.builder().lifterId(10L).normalizedName("Jane Smith").stableId(555L).build();
        Lifter b = Lifter.builder().lifterId(11L).normalizedName("Jane Smith").stableId(555L).build();
        when(repository.findByStableId(555L)).thenReturn(List.of(a, b));

        assertEquals(2, lookup.findByStableId(555L).size());
        assertTrue(lookup.isStableIdTaken(555L));
    }

    @Test
    @DisplayName("Should delegate name lookups to the repository")
    void testFindByName() {
        when(repository.findByName("Jane Smith")).thenReturn(List.of());

        assertTrue(lookup.findByName("Jane Smith").isEmpty());
        assertFalse(lookup.isStableIdTaken(1L));
        verify(repository).findByName("Jane Smith");
    }
}
