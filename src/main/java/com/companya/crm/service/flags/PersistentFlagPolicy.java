package com.companya.crm.service.flags;

import com.companya.crm.model.dto.FlagResult;

import java.util.Collection;
import java.util.Set;

/**
 * Status flags exempt from time-based expiry: once written they stay in the flag table across runs.
 * A child-addressed flag is persistent when its base flag type is.
 */
public class PersistentFlagPolicy {

    private final Set<String> persistentTypes;

    public PersistentFlagPolicy(Collection<String> persistentTypes) {
        this.persistentTypes = Set.copyOf(persistentTypes);
    }

    public boolean isPersistent(String flagType) {
        if (flagType == null) {
            return false;
        }
        String baseType = flagType.endsWith(FlagResult.CHILD_SUFFIX)
                ? flagType.substring(0, flagType.length() - FlagResult.CHILD_SUFFIX.length())
                : flagType;
        return persistentTypes.contains(baseType);
    }

    public Set<String> getPersistentTypes() {
        return persistentTypes;
    }
}
