package org.latticeville.runtime.spi;

import org.latticeville.runtime.action.Action;
import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.model.IWorldReader;

/**
 * Turns events and actions into natural-language sentences for memories and logs.
 * The world reader resolves ids to display names.
 */
public interface INarrationRenderer {

    String narrate(Event event, IWorldReader world);

    String narrate(Action action, String agentId, IWorldReader world);
}
