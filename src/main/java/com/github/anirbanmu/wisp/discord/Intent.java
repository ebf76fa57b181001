package com.github.anirbanmu.wisp.discord;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

// gateway intents, each a bit in the identify "intents" mask
public enum Intent {
    GUILDS(0),
    GUILD_MEMBERS(1), // privileged
    GUILD_MODERATION(2),
    GUILD_EMOJIS_AND_STICKERS(3),
    GUILD_INTEGRATIONS(4),
    GUILD_WEBHOOKS(5),
    GUILD_INVITES(6),
    GUILD_VOICE_STATES(7),
    GUILD_PRESENCES(8), // privileged
    GUILD_MESSAGES(9),
    GUILD_MESSAGE_REACTIONS(10),
    GUILD_MESSAGE_TYPING(11),
    DIRECT_MESSAGES(12),
    DIRECT_MESSAGE_REACTIONS(13),
    DIRECT_MESSAGE_TYPING(14),
    MESSAGE_CONTENT(15), // privileged
    GUILD_SCHEDULED_EVENTS(16),
    AUTO_MODERATION_CONFIGURATION(20),
    AUTO_MODERATION_EXECUTION(21);

    private final int bit;

    Intent(int bit) {
        this.bit = bit;
    }

    public int value() {
        return 1 << bit;
    }

    public static int mask(Collection<Intent> intents) {
        int mask = 0;
        for (Intent intent : intents) {
            mask |= intent.value();
        }
        return mask;
    }

    public static int all() {
        return mask(EnumSet.allOf(Intent.class));
    }

    // everything that does not need to be switched on in the developer portal
    public static int defaults() {
        Set<Intent> intents = EnumSet.allOf(Intent.class);
        intents.remove(GUILD_PRESENCES);
        intents.remove(GUILD_MEMBERS);
        intents.remove(MESSAGE_CONTENT);
        return mask(intents);
    }

    public static Intent fromString(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown intent: " + name);
        }
    }
}
