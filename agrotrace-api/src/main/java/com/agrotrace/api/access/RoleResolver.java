package com.agrotrace.api.access;

import com.agrotrace.api.practice.PracticeLogStore;
import com.agrotrace.api.registry.FarmerRegistryStore;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Resolves a caller's roles against the current role holders of both settings records.
 */
@Service
public class RoleResolver {

    private final FarmerRegistryStore registryStore;
    private final PracticeLogStore practiceLogStore;
    private final OperationSequencer sequencer;

    public RoleResolver(FarmerRegistryStore registryStore, PracticeLogStore practiceLogStore,
                        OperationSequencer sequencer) {
        this.registryStore = registryStore;
        this.practiceLogStore = practiceLogStore;
        this.sequencer = sequencer;
    }

    /**
     * @param subject identity whose records the caller acts on; {@code null} when there is none
     */
    public Set<Role> rolesOf(String caller, String subject) {
        AccessControl.requireCaller(caller);
        return sequencer.read(() -> AccessControl.resolveRoles(
                caller, subject, registryStore.settings(), practiceLogStore.settings()));
    }
}
