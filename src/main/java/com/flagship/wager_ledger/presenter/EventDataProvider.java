package com.flagship.wager_ledger.presenter;

import java.util.List;

/**
 * Source of scheduled events and their participants. An empty result means nothing is
 * available; implementations do not throw for lookup failures.
 */
public interface EventDataProvider {

    List<ScheduledEvent> listUpcomingEvents(String league);

    EventParticipants listParticipants(String eventRef);
}
