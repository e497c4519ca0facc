package com.alterante.plug.device;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceFamilyTest {

    @Test
    void knownModelCodes() {
        assertEquals(DeviceFamily.SINGLE_RELAY, DeviceFamily.forModelCode(0x2711));
        assertEquals(DeviceFamily.SINGLE_RELAY, DeviceFamily.forModelCode(0x753E));
        assertEquals(DeviceFamily.SINGLE_RELAY, DeviceFamily.forModelCode(0x947A));
        assertEquals(DeviceFamily.MULTI_RELAY, DeviceFamily.forModelCode(0x4EB5));
        assertEquals(DeviceFamily.MULTI_RELAY, DeviceFamily.forModelCode(0x4EF7));
    }

    @Test
    void unknownCodeIsBase() {
        assertEquals(DeviceFamily.BASE, DeviceFamily.forModelCode(0x0000));
        assertEquals(DeviceFamily.BASE, DeviceFamily.forModelCode(0x2712));
    }

    @Test
    void commandSetMatchesFamily() {
        for (DeviceFamily family : DeviceFamily.values()) {
            assertSame(family, family.commands().family());
        }
    }

    @Test
    void baseFamilySupportsNothing() {
        RelayCommandSet commands = DeviceFamily.BASE.commands();
        RecordingChannel channel = new RecordingChannel();

        assertThrows(NotSupportedException.class, () -> commands.setPower(channel, true));
        assertThrows(NotSupportedException.class, () -> commands.queryPower(channel));
        assertThrows(NotSupportedException.class, () -> commands.setPowerMask(channel, 1, true));
        assertThrows(NotSupportedException.class, () -> commands.setPowerByIndex(channel, 1, true));
        NotSupportedException e = assertThrows(NotSupportedException.class, () -> commands.queryPowerRaw(channel));
        assertEquals(DeviceFamily.BASE, e.family());
        assertTrue(channel.payloads.isEmpty(), "Nothing should reach the wire");
    }

    @Test
    void relayMaskHelpers() {
        assertEquals(0x01, RelayMask.forIndex(1));
        assertEquals(0x04, RelayMask.forIndex(3));
        assertEquals(0x80, RelayMask.forIndex(8));
        assertTrue(RelayMask.isOn(0x05, 1));
        assertFalse(RelayMask.isOn(0x05, 2));
        assertTrue(RelayMask.isOn(0x05, 3));
    }
}
