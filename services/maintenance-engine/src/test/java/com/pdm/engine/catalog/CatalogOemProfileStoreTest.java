package com.pdm.engine.catalog;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentProfile;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogOemProfileStoreTest {

    @Test
    void shouldLoadAllBundledProfiles() {
        CatalogOemProfileStore store =
                CatalogOemProfileStore.fromResource(new ClassPathResource("catalog/oem-profiles.json"));

        assertThat(store.allProfiles()).hasSize(EquipmentType.values().length);
        EquipmentProfile rope = store.getProfile(EquipmentType.WIRE_ROPE);
        assertThat(rope.manufacturer()).isEqualTo("Bridon-Bekaert");
        assertThat(rope.specs().expectedLifeCycles()).isEqualTo(15000);
        assertThat(rope.wearCurve()).hasSize(7);
    }

    @Test
    void shouldThrowForTypeWithoutProfile() {
        CatalogOemProfileStore store = new CatalogOemProfileStore(List.of(
                EquipmentProfile.builder().id("rope").equipmentType(EquipmentType.WIRE_ROPE).build()));

        assertThat(store.findProfile(EquipmentType.GENERATOR)).isEmpty();
        assertThatThrownBy(() -> store.getProfile(EquipmentType.GENERATOR))
                .isInstanceOf(UnknownEquipmentProfileException.class)
                .hasMessageContaining("generator");
    }

    @Test
    void shouldRejectDuplicateProfiles() {
        EquipmentProfile first = EquipmentProfile.builder().id("a").equipmentType(EquipmentType.PUMP_SYSTEM).build();
        EquipmentProfile second = EquipmentProfile.builder().id("b").equipmentType(EquipmentType.PUMP_SYSTEM).build();

        assertThatThrownBy(() -> new CatalogOemProfileStore(List.of(first, second)))
                .isInstanceOf(CatalogLoadException.class)
                .hasMessageContaining("pump_system");
    }

    @Test
    void shouldRejectCatalogWithRisingWearCurve() {
        ByteArrayResource invalid = new ByteArrayResource("""
                [
                  {
                    "id": "bad",
                    "equipmentType": "generator",
                    "wearCurve": [
                      {"cycles": 0, "healthPercent": 90},
                      {"cycles": 1000, "healthPercent": 95}
                    ]
                  }
                ]
                """.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> CatalogOemProfileStore.fromResource(invalid))
                .isInstanceOf(CatalogLoadException.class);
    }

    @Test
    void shouldRejectMissingCatalog() {
        assertThatThrownBy(() -> CatalogOemProfileStore.fromResource(new ClassPathResource("catalog/missing.json")))
                .isInstanceOf(CatalogLoadException.class)
                .hasMessageContaining("not found");
    }
}
