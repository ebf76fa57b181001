package com.github.anirbanmu.wisp.event;

import com.github.anirbanmu.wisp.WispClient;
import com.github.anirbanmu.wisp.discord.Gateway;
import java.util.Map;

// handles one dispatch event type. runs off the gateway thread; exceptions go to the ErrorSink
@FunctionalInterface
public interface EventHandler {
    void handle(WispClient client, Gateway gateway, Map<String, Object> data) throws Exception;
}
