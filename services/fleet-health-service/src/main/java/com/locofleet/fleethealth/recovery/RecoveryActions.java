package com.locofleet.fleethealth.recovery;

import com.locofleet.fleethealth.discovery.FleetInstance;

/**
 * Recovery actions. Implementations must be idempotent: a later cycle may repeat an action
 * before the previous one has taken effect.
 *
 * @throws com.locofleet.common.exception.RecoveryActionException from any method when the action fails
 */
public interface RecoveryActions {

    /**
     * Resets the instance's network interfaces.
     */
    void recoverNetwork(FleetInstance instance);

    /**
     * Restarts the emulator subsystem of the instance.
     */
    void recoverSubsystem(FleetInstance instance);
}
