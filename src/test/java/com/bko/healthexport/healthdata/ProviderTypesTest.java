package com.bko.healthexport.healthdata;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderTypesTest {

    @Test
    void resolvesKnownIdentifiers() {
        assertEquals(ProviderActivityType.FUNCTIONAL_STRENGTH_TRAINING,
                ProviderActivityType.fromIdentifier("functionalStrengthTraining"));
        assertEquals(ProviderEventType.MOTION_RESUMED, ProviderEventType.fromIdentifier("motionResumed"));
        assertEquals(QuantityKind.RUNNING_POWER, QuantityKind.fromIdentifier("runningPower").orElseThrow());
    }

    @Test
    void unknownProviderKindsAreUnrecognizedInsteadOfFailing() {
        assertEquals(ProviderActivityType.UNRECOGNIZED, ProviderActivityType.fromIdentifier("underwaterHockey"));
        assertEquals(ProviderActivityType.UNRECOGNIZED, ProviderActivityType.fromIdentifier(null));
        assertEquals(ProviderEventType.UNRECOGNIZED, ProviderEventType.fromIdentifier("somethingNew"));
        assertTrue(QuantityKind.fromIdentifier("bloodGlucose").isEmpty());
    }
}
