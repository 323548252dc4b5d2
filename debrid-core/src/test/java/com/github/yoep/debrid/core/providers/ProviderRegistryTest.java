package com.github.yoep.debrid.core.providers;

import com.github.yoep.debrid.adapter.DebridProvider;
import com.github.yoep.debrid.adapter.ProviderType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderRegistryTest {
    @Mock
    private DebridProvider realDebrid;
    @Mock
    private DebridProvider premiumize;
    @Mock
    private DebridProvider putio;

    @Test
    void testConstructor_whenProvidersAreUnordered_shouldOrderThemByType() {
        when(realDebrid.getType()).thenReturn(ProviderType.REAL_DEBRID);
        when(premiumize.getType()).thenReturn(ProviderType.PREMIUMIZE);
        when(putio.getType()).thenReturn(ProviderType.PUTIO);

        var registry = new ProviderRegistry(Arrays.asList(putio, premiumize, realDebrid));

        assertEquals(Arrays.asList("realdebrid", "premiumize", "putio"), registry.getKeys());
        assertSame(realDebrid, registry.getDescriptors().get(0).provider());
    }

    @Test
    void testConstructor_whenTypeIsRegisteredTwice_shouldThrowIllegalStateException() {
        when(realDebrid.getType()).thenReturn(ProviderType.REAL_DEBRID);
        when(premiumize.getType()).thenReturn(ProviderType.REAL_DEBRID);
        var providers = Arrays.asList(realDebrid, premiumize);

        assertThrows(IllegalStateException.class, () -> new ProviderRegistry(providers));
    }

    @Test
    void testConstructor_whenProviderHasNoType_shouldThrowIllegalArgumentException() {
        var providers = Collections.singletonList(realDebrid);

        assertThrows(IllegalArgumentException.class, () -> new ProviderRegistry(providers));
    }

    @Test
    void testGetDescriptor_whenKeyIsRegistered_shouldReturnDescriptor() {
        when(putio.getType()).thenReturn(ProviderType.PUTIO);
        var registry = new ProviderRegistry(Collections.singletonList(putio));

        var result = registry.getDescriptor("putio");

        assertTrue(result.isPresent(), "expected the descriptor to have been found");
        assertEquals("Put.io", result.get().displayName());
        assertEquals("Putio", result.get().shortName());
        assertFalse(result.get().supportsCatalog());
    }

    @Test
    void testGetDescriptor_whenKeyIsUnknown_shouldReturnEmpty() {
        var registry = new ProviderRegistry(Collections.emptyList());

        assertTrue(registry.getDescriptor("realdebrid").isEmpty());
        assertTrue(registry.getDescriptor(null).isEmpty());
        assertFalse(registry.isRegistered("realdebrid"));
    }

    @Test
    void testGetRequiredDescriptor_whenKeyIsUnknown_shouldThrowProviderNotFoundException() {
        var registry = new ProviderRegistry(Collections.emptyList());

        var ex = assertThrows(ProviderNotFoundException.class, () -> registry.getRequiredDescriptor("lorem"));

        assertEquals("lorem", ex.getKey());
    }
}
