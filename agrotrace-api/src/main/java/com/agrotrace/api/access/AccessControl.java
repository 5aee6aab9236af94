package com.agrotrace.api.access;

import com.agrotrace.core.domain.PracticeLogSettings;
import com.agrotrace.core.domain.RegistrySettings;

import java.util.EnumSet;
import java.util.Set;

/**
 * Role predicates over the settings records. All checks are pure functions of their arguments.
 */
public final class AccessControl {

    private AccessControl() {}

    public static boolean isRegistryOwner(RegistrySettings settings, String caller) {
        return caller != null && caller.equals(settings.getOwner());
    }

    public static boolean isVerifier(RegistrySettings settings, String caller) {
        return caller != null && caller.equals(settings.getVerifier());
    }

    public static boolean isLogOwner(PracticeLogSettings settings, String caller) {
        return caller != null && caller.equals(settings.getOwner());
    }

    public static boolean isModerator(PracticeLogSettings settings, String caller) {
        return caller != null && caller.equals(settings.getModerator());
    }

    public static boolean isSelf(String caller, String subject) {
        return caller != null && caller.equals(subject);
    }

    /**
     * Resolves every role {@code caller} holds when acting on {@code subject}'s records.
     */
    public static Set<Role> resolveRoles(String caller, String subject,
                                         RegistrySettings registry, PracticeLogSettings practiceLog) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        if (isRegistryOwner(registry, caller) || isLogOwner(practiceLog, caller)) {
            roles.add(Role.OWNER);
        }
        if (isVerifier(registry, caller)) {
            roles.add(Role.VERIFIER);
        }
        if (isModerator(practiceLog, caller)) {
            roles.add(Role.MODERATOR);
        }
        if (isSelf(caller, subject)) {
            roles.add(Role.SELF);
        }
        return roles;
    }

    /**
     * Rejects a missing or blank caller identity.
     */
    public static String requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller identity is required");
        }
        return caller;
    }
}
