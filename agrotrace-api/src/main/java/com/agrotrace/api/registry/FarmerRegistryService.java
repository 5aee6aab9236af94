package com.agrotrace.api.registry;

import com.agrotrace.api.access.AccessControl;
import com.agrotrace.api.access.OperationSequencer;
import com.agrotrace.core.domain.FarmerProfile;
import com.agrotrace.core.domain.RegistrySettings;
import com.agrotrace.core.domain.VerificationStatus;
import com.agrotrace.core.result.OperationResult;
import com.agrotrace.core.result.RegistryError;
import com.agrotrace.ledger.TransferException;
import com.agrotrace.ledger.ValueTransfer;
import com.agrotrace.ledger.clock.LogicalClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Farmer Registry - onboards farmer identities and runs their verification workflow.
 *
 * Every mutating operation goes through the {@link OperationSequencer}: all guards are
 * evaluated before the first write, and the registration fee is collected before the profile
 * is created, so a rejected operation leaves the registry unchanged.
 *
 * Profile state machine: unregistered -> PENDING -> VERIFIED | REJECTED (terminal).
 * The active flag is independent and can only be cleared.
 */
@Service
public class FarmerRegistryService implements FarmerVerificationSource {

    private static final Logger log = LoggerFactory.getLogger(FarmerRegistryService.class);

    private final FarmerRegistryStore store;
    private final ValueTransfer ledger;
    private final LogicalClock clock;
    private final OperationSequencer sequencer;
    private final String treasuryAccount;

    @Autowired
    public FarmerRegistryService(FarmerRegistryStore store, ValueTransfer ledger, LogicalClock clock,
                                 OperationSequencer sequencer, RegistryProperties properties) {
        this(store, ledger, clock, sequencer, properties.getTreasuryAccount());
    }

    public FarmerRegistryService(FarmerRegistryStore store, ValueTransfer ledger, LogicalClock clock,
                                 OperationSequencer sequencer, String treasuryAccount) {
        this.store = store;
        this.ledger = ledger;
        this.clock = clock;
        this.sequencer = sequencer;
        this.treasuryAccount = treasuryAccount;
    }

    // ==================== Onboarding ====================

    /**
     * Registers the caller as a new farmer and collects the registration fee.
     *
     * @return the assigned farmer id
     */
    public OperationResult<Long> register(String caller, String name, String location,
                                          long farmSize, String additionalInfo) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("register", () -> {
            if (store.existsByPrincipal(caller)) {
                return OperationResult.failure(RegistryError.ALREADY_REGISTERED);
            }
            if (isEmpty(name) || isEmpty(location) || farmSize <= 0) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }

            RegistrySettings settings = store.settings();
            BigInteger fee = settings.getRegistrationFee();
            long now = clock.current();
            if (fee.signum() > 0) {
                try {
                    ledger.transfer(caller, treasuryAccount, fee);
                } catch (TransferException e) {
                    log.debug("Registration fee for {} refused: {}", caller, e.getMessage());
                    return OperationResult.failure(e.getError());
                }
            }

            long id = settings.allocateFarmerId();
            settings.creditBalance(fee);
            store.insert(FarmerProfile.register(id, caller, name, location, farmSize, additionalInfo, now));
            store.saveSettings(settings);
            sequencer.afterCommit(clock::advance);

            log.info("Registered farmer {} with id {} (fee {})", caller, id, fee);
            return OperationResult.ok(id);
        });
    }

    /**
     * Owner-only bulk onboarding. No fee is charged and every entry is created already VERIFIED,
     * skipping the verifier. All entries are created or none is.
     *
     * @return the assigned ids, in input order
     */
    public OperationResult<List<Long>> registerBatch(String caller, List<BatchRegistration> entries) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("registerBatch", () -> {
            RegistrySettings settings = store.settings();
            if (!AccessControl.isRegistryOwner(settings, caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            if (entries == null || entries.isEmpty()) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }

            Set<String> seen = new HashSet<>();
            for (BatchRegistration entry : entries) {
                if (entry == null || isEmpty(entry.principal())) {
                    return OperationResult.failure(RegistryError.INVALID_INPUT);
                }
                if (!seen.add(entry.principal()) || store.existsByPrincipal(entry.principal())) {
                    return OperationResult.failure(RegistryError.ALREADY_REGISTERED);
                }
                if (isEmpty(entry.name()) || isEmpty(entry.location()) || entry.farmSize() <= 0) {
                    return OperationResult.failure(RegistryError.INVALID_INPUT);
                }
            }

            long now = clock.current();
            List<Long> ids = new ArrayList<>(entries.size());
            for (BatchRegistration entry : entries) {
                long id = settings.allocateFarmerId();
                FarmerProfile profile = FarmerProfile.register(id, entry.principal(), entry.name(),
                        entry.location(), entry.farmSize(), entry.additionalInfo(), now);
                profile.decideVerification(VerificationStatus.VERIFIED, now);
                store.insert(profile);
                ids.add(id);
            }
            store.saveSettings(settings);
            sequencer.afterCommit(clock::advance);

            log.warn("Batch-registered {} farmers as VERIFIED by owner {} without verifier review: ids {}",
                    ids.size(), caller, ids);
            return OperationResult.ok(List.copyOf(ids));
        });
    }

    // ==================== Verification Workflow ====================

    /**
     * Records the verifier's decision on a PENDING profile.
     *
     * @param status wire form, {@code "verified"} or {@code "rejected"}
     */
    public OperationResult<Boolean> verify(String caller, String farmer, String status) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("verify", () -> {
            if (!AccessControl.isVerifier(store.settings(), caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            Optional<FarmerProfile> found = store.findByPrincipal(farmer);
            if (found.isEmpty()) {
                return OperationResult.failure(RegistryError.NOT_REGISTERED);
            }
            Optional<VerificationStatus> decision = VerificationStatus.fromWire(status)
                    .filter(VerificationStatus::isTerminal);
            if (decision.isEmpty()) {
                return OperationResult.failure(RegistryError.INVALID_STATUS);
            }
            FarmerProfile profile = found.get();
            if (profile.getVerificationStatus() != VerificationStatus.PENDING) {
                return OperationResult.failure(RegistryError.ALREADY_VERIFIED);
            }

            profile.decideVerification(decision.get(), clock.current());
            store.update(profile);
            sequencer.afterCommit(clock::advance);

            log.info("Farmer {} marked {} by verifier {}", farmer, decision.get().wireValue(), caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    /**
     * Applies a partial update to the caller's own, verified profile.
     */
    public OperationResult<Boolean> updateProfile(String caller, ProfileUpdate update) {
        AccessControl.requireCaller(caller);
        ProfileUpdate patch = update != null ? update : ProfileUpdate.of(null, null, null, null);
        return sequencer.execute("updateProfile", () -> {
            Optional<FarmerProfile> found = store.findByPrincipal(caller);
            if (found.isEmpty()) {
                return OperationResult.failure(RegistryError.NOT_REGISTERED);
            }
            FarmerProfile profile = found.get();
            if (!profile.isVerified()) {
                return OperationResult.failure(RegistryError.NOT_VERIFIED);
            }
            if (patch.effectiveFarmSize().filter(size -> size < 0).isPresent()) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }

            patch.effectiveName().ifPresent(profile::rename);
            patch.effectiveLocation().ifPresent(profile::relocate);
            patch.effectiveFarmSize().ifPresent(profile::resize);
            patch.effectiveAdditionalInfo().ifPresent(profile::describe);
            store.update(profile);

            log.info("Farmer {} updated profile", caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    /**
     * Owner-only. Clears the farmer's active flag for good.
     */
    public OperationResult<Boolean> deactivate(String caller, String farmer) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("deactivate", () -> {
            if (!AccessControl.isRegistryOwner(store.settings(), caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            Optional<FarmerProfile> found = store.findByPrincipal(farmer);
            if (found.isEmpty()) {
                return OperationResult.failure(RegistryError.NOT_REGISTERED);
            }
            FarmerProfile profile = found.get();
            profile.deactivate();
            store.update(profile);

            log.info("Farmer {} deactivated by owner {}", farmer, caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    // ==================== Owner Settings ====================

    public OperationResult<Boolean> setRegistrationFee(String caller, BigInteger fee) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("setRegistrationFee", () -> {
            RegistrySettings settings = store.settings();
            if (!AccessControl.isRegistryOwner(settings, caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            if (fee == null || fee.signum() < 0) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }
            settings.changeRegistrationFee(fee);
            store.saveSettings(settings);
            log.info("Registration fee set to {} by {}", fee, caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    public OperationResult<Boolean> setVerifier(String caller, String verifier) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("setVerifier", () -> {
            RegistrySettings settings = store.settings();
            if (!AccessControl.isRegistryOwner(settings, caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            if (isBlank(verifier)) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }
            settings.changeVerifier(verifier);
            store.saveSettings(settings);
            log.info("Verifier set to {} by {}", verifier, caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    public OperationResult<Boolean> transferOwnership(String caller, String newOwner) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("transferRegistryOwnership", () -> {
            RegistrySettings settings = store.settings();
            if (!AccessControl.isRegistryOwner(settings, caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            if (isBlank(newOwner)) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }
            settings.changeOwner(newOwner);
            store.saveSettings(settings);
            log.info("Registry ownership moved from {} to {}", caller, newOwner);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    /**
     * Owner-only. Pays {@code amount} of the collected fees out to the owner.
     */
    public OperationResult<Boolean> withdrawFees(String caller, BigInteger amount) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("withdrawFees", () -> {
            RegistrySettings settings = store.settings();
            if (!AccessControl.isRegistryOwner(settings, caller)) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            if (amount == null || amount.signum() <= 0
                    || amount.compareTo(settings.getContractBalance()) > 0) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }
            try {
                ledger.transfer(treasuryAccount, caller, amount);
            } catch (TransferException e) {
                log.error("Treasury payout of {} to {} refused: {}", amount, caller, e.getMessage());
                return OperationResult.failure(e.getError());
            }
            settings.debitBalance(amount);
            store.saveSettings(settings);

            log.info("Owner {} withdrew {} in fees", caller, amount);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    // ==================== Reads ====================

    public Optional<FarmerProfileView> getProfile(String principal) {
        return sequencer.read(() -> store.findByPrincipal(principal).map(FarmerProfileView::of));
    }

    public Optional<FarmerProfileView> getById(long id) {
        return sequencer.read(() -> store.findById(id).map(FarmerProfileView::of));
    }

    @Override
    public boolean isVerified(String principal) {
        return sequencer.read(() -> store.findByPrincipal(principal)
                .map(FarmerProfile::isVerified)
                .orElse(false));
    }

    public String getOwner() {
        return sequencer.read(() -> store.settings().getOwner());
    }

    public String getVerifier() {
        return sequencer.read(() -> store.settings().getVerifier());
    }

    public BigInteger getRegistrationFee() {
        return sequencer.read(() -> store.settings().getRegistrationFee());
    }

    public BigInteger getContractBalance() {
        return sequencer.read(() -> store.settings().getContractBalance());
    }

    /**
     * Number of farmers ever registered.
     */
    public long getFarmerCount() {
        return sequencer.read(() -> store.settings().getNextFarmerId() - 1);
    }

    public RegistrySettingsView getSettings() {
        return sequencer.read(() -> {
            RegistrySettings settings = store.settings();
            return new RegistrySettingsView(
                    settings.getOwner(),
                    settings.getVerifier(),
                    settings.getRegistrationFee(),
                    settings.getContractBalance(),
                    settings.getNextFarmerId() - 1);
        });
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
