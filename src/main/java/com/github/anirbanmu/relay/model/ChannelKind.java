package com.github.anirbanmu.relay.model;

// closed set of channel types; anything discord adds later maps to UNSUPPORTED
public enum ChannelKind {
    GUILD_TEXT(0),
    DM(1),
    GUILD_VOICE(2),
    GROUP_DM(3),
    GUILD_CATEGORY(4),
    GUILD_ANNOUNCEMENT(5),
    ANNOUNCEMENT_THREAD(10),
    PUBLIC_THREAD(11),
    PRIVATE_THREAD(12),
    GUILD_STAGE_VOICE(13),
    GUILD_DIRECTORY(14),
    GUILD_FORUM(15),
    GUILD_MEDIA(16),
    UNSUPPORTED(-1);

    private final int code;

    ChannelKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ChannelKind of(int code) {
        for (ChannelKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return UNSUPPORTED;
    }

    // messages can be sent here
    public boolean isTextual() {
        switch (this) {
            case GUILD_TEXT:
            case DM:
            case GROUP_DM:
            case GUILD_ANNOUNCEMENT:
            case ANNOUNCEMENT_THREAD:
            case PUBLIC_THREAD:
            case PRIVATE_THREAD:
            case GUILD_VOICE:
            case GUILD_STAGE_VOICE:
                return true;
            default:
                return false;
        }
    }

    public boolean isGuild() {
        return this != DM && this != GROUP_DM && this != UNSUPPORTED;
    }

    public boolean isThread() {
        return this == ANNOUNCEMENT_THREAD || this == PUBLIC_THREAD || this == PRIVATE_THREAD;
    }
}
