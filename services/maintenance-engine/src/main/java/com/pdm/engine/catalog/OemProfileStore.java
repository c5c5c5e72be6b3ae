package com.pdm.engine.catalog;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentProfile;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only source of OEM reference data, one profile per equipment type.
 * Implementations may be in-memory or backed by an OEM catalog service.
 */
public interface OemProfileStore {

    /**
     * @throws UnknownEquipmentProfileException if the type has no profile
     */
    default EquipmentProfile getProfile(EquipmentType type) {
        return findProfile(type).orElseThrow(() -> new UnknownEquipmentProfileException(type));
    }

    Optional<EquipmentProfile> findProfile(EquipmentType type);

    Collection<EquipmentProfile> allProfiles();
}
