package com.agrotrace.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the registry records.
 */
class FarmerProfilePropertyTest {

    // ==================== Verification Transitions ====================

    /**
     * Property: a decision is recorded once; any second decision is refused and changes nothing.
     */
    @Property(tries = 50)
    void verification_isDecidedAtMostOnce(
            @ForAll("decisions") VerificationStatus first,
            @ForAll("decisions") VerificationStatus second,
            @ForAll @LongRange(min = 1, max = 1_000_000) long decidedAt) {

        FarmerProfile profile = newProfile();
        profile.decideVerification(first, decidedAt);

        assertThatThrownBy(() -> profile.decideVerification(second, decidedAt + 1))
                .isInstanceOf(IllegalStateException.class);
        assertThat(profile.getVerificationStatus()).isEqualTo(first);
        assertThat(profile.getVerificationTimestamp()).isEqualTo(decidedAt);
    }

    @Test
    void pendingIsNotADecision() {
        FarmerProfile profile = newProfile();

        assertThatThrownBy(() -> profile.decideVerification(VerificationStatus.PENDING, 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(profile.getVerificationStatus()).isEqualTo(VerificationStatus.PENDING);
        assertThat(profile.getVerificationTimestamp()).isNull();
    }

    @Test
    void newProfile_isPendingAndActive() {
        FarmerProfile profile = newProfile();

        assertThat(profile.getVerificationStatus()).isEqualTo(VerificationStatus.PENDING);
        assertThat(profile.isActive()).isTrue();
        assertThat(profile.isVerified()).isFalse();
        assertThat(profile.getRegistrationTimestamp()).isEqualTo(100);
    }

    @Property(tries = 50)
    void resize_rejectsNonPositiveSizes(@ForAll @LongRange(min = -1000, max = 0) long size) {
        FarmerProfile profile = newProfile();

        assertThatThrownBy(() -> profile.resize(size)).isInstanceOf(IllegalArgumentException.class);
        assertThat(profile.getFarmSize()).isEqualTo(100);
    }

    @Test
    void deactivate_isOneWay() {
        FarmerProfile profile = newProfile();
        profile.deactivate();
        profile.deactivate();

        assertThat(profile.isActive()).isFalse();
    }

    @Test
    void wireValues_roundTripThroughFromWire() {
        assertThat(VerificationStatus.fromWire("verified")).contains(VerificationStatus.VERIFIED);
        assertThat(VerificationStatus.fromWire("Verified")).isEmpty();
        assertThat(VerificationStatus.fromWire(null)).isEmpty();
        assertThat(ModerationStatus.fromWire("approved")).contains(ModerationStatus.APPROVED);
    }

    // ==================== Settings Record ====================

    /**
     * Property: farmer ids are handed out as 1, 2, 3, ... without gaps or reuse.
     */
    @Property(tries = 30)
    void farmerIds_areSequentialFromOne(@ForAll @IntRange(min = 1, max = 50) int count) {
        RegistrySettings settings = RegistrySettings.initial("owner", "verifier", BigInteger.TEN);

        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add(settings.allocateFarmerId());
        }

        for (int i = 0; i < count; i++) {
            assertThat(ids.get(i)).isEqualTo(i + 1L);
        }
        assertThat(settings.getNextFarmerId()).isEqualTo(count + 1L);
    }

    /**
     * Property: the fee balance never goes negative.
     */
    @Property(tries = 50)
    void contractBalance_neverGoesNegative(
            @ForAll @BigRange(min = "0", max = "1000000") BigInteger credited,
            @ForAll @BigRange(min = "1", max = "1000000") BigInteger extra) {

        RegistrySettings settings = RegistrySettings.initial("owner", "verifier", BigInteger.ONE);
        settings.creditBalance(credited);

        assertThatThrownBy(() -> settings.debitBalance(credited.add(extra)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(settings.getContractBalance()).isEqualTo(credited);

        settings.debitBalance(credited);
        assertThat(settings.getContractBalance()).isZero();
    }

    @Test
    void negativeFee_isRefused() {
        RegistrySettings settings = RegistrySettings.initial("owner", "verifier", BigInteger.ONE);

        assertThatThrownBy(() -> settings.changeRegistrationFee(BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(settings.getRegistrationFee()).isEqualTo(BigInteger.ONE);
    }

    @Provide
    Arbitrary<VerificationStatus> decisions() {
        return Arbitraries.of(VerificationStatus.VERIFIED, VerificationStatus.REJECTED);
    }

    private static FarmerProfile newProfile() {
        return FarmerProfile.register(1, "farmer-1", "John Doe", "Rural Area", 100, "Organic farm", 100);
    }
}
