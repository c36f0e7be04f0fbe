package com.questrail.insights.client;

import com.questrail.insights.model.ProtectModelKind;

import java.util.Objects;

/**
 * ProtectCommand
 * -----------------------------------------------------------------------------
 * Commands the projection layer forwards to video/sensor entities.
 *
 * <p>Commands are plain data. The {@link EventClient} implementation decides
 * how each variant maps onto the remote API; nothing here validates ranges or
 * enumerated values.</p>
 */
public sealed interface ProtectCommand
        permits ProtectCommand.SetRecordingMode,
                ProtectCommand.SetHdrMode,
                ProtectCommand.SetVideoMode,
                ProtectCommand.SetMicVolume,
                ProtectCommand.SetLightMode,
                ProtectCommand.SetLightLevel,
                ProtectCommand.SetChimeVolume,
                ProtectCommand.SetChimeRingtone,
                ProtectCommand.SetChimeRepeatTimes,
                ProtectCommand.PlayChimeRingtone,
                ProtectCommand.PtzGotoPreset,
                ProtectCommand.PtzPatrolStart,
                ProtectCommand.PtzPatrolStop
{
    /** Kind of entity the command addresses. */
    ProtectModelKind target();

    /** Identifier of the addressed entity. */
    String targetId();

    record SetRecordingMode(String cameraId, String mode) implements ProtectCommand {
        public SetRecordingMode {
            Objects.requireNonNull(cameraId, "cameraId");
            Objects.requireNonNull(mode, "mode");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }

    record SetHdrMode(String cameraId, String mode) implements ProtectCommand {
        public SetHdrMode {
            Objects.requireNonNull(cameraId, "cameraId");
            Objects.requireNonNull(mode, "mode");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }

    record SetVideoMode(String cameraId, String mode) implements ProtectCommand {
        public SetVideoMode {
            Objects.requireNonNull(cameraId, "cameraId");
            Objects.requireNonNull(mode, "mode");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }

    record SetMicVolume(String cameraId, int volume) implements ProtectCommand {
        public SetMicVolume {
            Objects.requireNonNull(cameraId, "cameraId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }

    record SetLightMode(String lightId, String mode) implements ProtectCommand {
        public SetLightMode {
            Objects.requireNonNull(lightId, "lightId");
            Objects.requireNonNull(mode, "mode");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.LIGHT; }
        @Override public String targetId() { return lightId; }
    }

    record SetLightLevel(String lightId, int level) implements ProtectCommand {
        public SetLightLevel {
            Objects.requireNonNull(lightId, "lightId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.LIGHT; }
        @Override public String targetId() { return lightId; }
    }

    /** {@code cameraId} may be {@code null} to address the chime's default pairing. */
    record SetChimeVolume(String chimeId, int volume, String cameraId) implements ProtectCommand {
        public SetChimeVolume {
            Objects.requireNonNull(chimeId, "chimeId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CHIME; }
        @Override public String targetId() { return chimeId; }
    }

    record SetChimeRingtone(String chimeId, String ringtoneId, String cameraId) implements ProtectCommand {
        public SetChimeRingtone {
            Objects.requireNonNull(chimeId, "chimeId");
            Objects.requireNonNull(ringtoneId, "ringtoneId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CHIME; }
        @Override public String targetId() { return chimeId; }
    }

    record SetChimeRepeatTimes(String chimeId, int repeatTimes, String cameraId) implements ProtectCommand {
        public SetChimeRepeatTimes {
            Objects.requireNonNull(chimeId, "chimeId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CHIME; }
        @Override public String targetId() { return chimeId; }
    }

    /** {@code ringtoneId} may be {@code null} to play the configured ringtone. */
    record PlayChimeRingtone(String chimeId, String ringtoneId) implements ProtectCommand {
        public PlayChimeRingtone {
            Objects.requireNonNull(chimeId, "chimeId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CHIME; }
        @Override public String targetId() { return chimeId; }
    }

    record PtzGotoPreset(String cameraId, int preset) implements ProtectCommand {
        public PtzGotoPreset {
            Objects.requireNonNull(cameraId, "cameraId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }

    record PtzPatrolStart(String cameraId, int slot) implements ProtectCommand {
        public PtzPatrolStart {
            Objects.requireNonNull(cameraId, "cameraId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }

    record PtzPatrolStop(String cameraId) implements ProtectCommand {
        public PtzPatrolStop {
            Objects.requireNonNull(cameraId, "cameraId");
        }
        @Override public ProtectModelKind target() { return ProtectModelKind.CAMERA; }
        @Override public String targetId() { return cameraId; }
    }
}
