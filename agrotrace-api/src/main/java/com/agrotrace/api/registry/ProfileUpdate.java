package com.agrotrace.api.registry;

import java.util.Optional;

/**
 * Partial update of a farmer's own profile. An empty Optional means "not provided".
 *
 * A provided empty string, or a provided farm size of zero, is treated the same as not provided;
 * such values cannot be used to clear a field.
 */
public record ProfileUpdate(
        Optional<String> name,
        Optional<String> location,
        Optional<Long> farmSize,
        Optional<String> additionalInfo
) {

    public ProfileUpdate {
        name = name != null ? name : Optional.empty();
        location = location != null ? location : Optional.empty();
        farmSize = farmSize != null ? farmSize : Optional.empty();
        additionalInfo = additionalInfo != null ? additionalInfo : Optional.empty();
    }

    /**
     * Builds an update from nullable values, null meaning "not provided".
     */
    public static ProfileUpdate of(String name, String location, Long farmSize, String additionalInfo) {
        return new ProfileUpdate(
                Optional.ofNullable(name),
                Optional.ofNullable(location),
                Optional.ofNullable(farmSize),
                Optional.ofNullable(additionalInfo));
    }

    Optional<String> effectiveName() {
        return name.filter(v -> !v.isEmpty());
    }

    Optional<String> effectiveLocation() {
        return location.filter(v -> !v.isEmpty());
    }

    Optional<Long> effectiveFarmSize() {
        return farmSize.filter(v -> v != 0L);
    }

    Optional<String> effectiveAdditionalInfo() {
        return additionalInfo.filter(v -> !v.isEmpty());
    }
}
