package com.github.anirbanmu.wisp.discord.json;

import com.dslplatform.json.CompiledJson;
import java.util.List;

// presence block of identify, and the whole payload of opcode 3
@CompiledJson
public record Presence(long since, List<Activity> activities, String status, boolean afk) {

    // either argument may be null: no activity, status online
    public static Presence of(Activity activity, StatusType status) {
        return new Presence(
            System.currentTimeMillis(),
            activity == null ? List.of() : List.of(activity),
            (status == null ? StatusType.ONLINE : status).value(),
            false);
    }
}
