package com.pdm.engine.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OEM profiles held in memory, loaded once from a JSON catalog.
 */
@Slf4j
public class CatalogOemProfileStore implements OemProfileStore {

    private static final TypeReference<List<EquipmentProfile>> PROFILE_LIST = new TypeReference<>() {};

    private final Map<EquipmentType, EquipmentProfile> profiles;

    public CatalogOemProfileStore(Collection<EquipmentProfile> profiles) {
        Map<EquipmentType, EquipmentProfile> byType = new EnumMap<>(EquipmentType.class);
        for (EquipmentProfile profile : profiles) {
            if (profile.equipmentType() == null) {
                throw new CatalogLoadException("OEM profile " + profile.id() + " has no equipment type");
            }
            if (byType.putIfAbsent(profile.equipmentType(), profile) != null) {
                throw new CatalogLoadException("Duplicate OEM profile for " + profile.equipmentType().getValue());
            }
        }
        this.profiles = Collections.unmodifiableMap(byType);
    }

    public static CatalogOemProfileStore fromResource(Resource resource) {
        List<EquipmentProfile> loaded = CatalogReader.read(resource, PROFILE_LIST);
        CatalogOemProfileStore store = new CatalogOemProfileStore(loaded);
        log.info("Loaded {} OEM profiles from {}", store.profiles.size(), resource.getDescription());
        for (EquipmentType type : EquipmentType.values()) {
            if (!store.profiles.containsKey(type)) {
                log.warn("No OEM profile for equipment type {}; analyses referencing it will fail", type.getValue());
            }
        }
        return store;
    }

    @Override
    public Optional<EquipmentProfile> findProfile(EquipmentType type) {
        return Optional.ofNullable(type).map(profiles::get);
    }

    @Override
    public Collection<EquipmentProfile> allProfiles() {
        return profiles.values();
    }
}
