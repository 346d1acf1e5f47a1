package de.bsommerfeld.anchor.universe;

import org.junit.jupiter.api.Test;

import java.lang.module.ResolvedModule;

import static org.junit.jupiter.api.Assertions.*;

class ModuleTypeSourceTest {

    @Test
    void load_shouldListCoreRuntimeTypes() {
        TypeLoadResult result = source("java.base").load();

        assertEquals("java.base", result.source());
        assertTrue(result.loaded().contains(Object.class));
        assertTrue(result.loaded().contains(String.class));
        assertTrue(result.loaded().contains(java.util.Map.Entry.class));
    }

    @Test
    void load_shouldNotListModuleDescriptor() {
        TypeLoadResult result = source("java.logging").load();

        assertTrue(result.loaded().stream().noneMatch(type -> type.getName().endsWith("module-info")));
        assertTrue(result.loaded().contains(java.util.logging.Logger.class));
    }

    private static ModuleTypeSource source(String name) {
        ModuleLayer layer = ModuleLayer.boot();
        ResolvedModule resolved = layer.configuration().findModule(name).orElseThrow();
        return new ModuleTypeSource(resolved.reference(), layer.findModule(name).orElseThrow());
    }
}
