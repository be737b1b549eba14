package com.flagship.wager_ledger.presenter;

import com.flagship.wager_ledger.wager.Wager;

import java.util.List;

/**
 * Rendering side of the chat layer: posts finished wagers and notices, lists destinations.
 * Choice and form rendering happens on the caller's side from the prompts the wizard returns.
 */
public interface Presenter {

    /**
     * Renders the wager and posts it to its destination.
     *
     * @return reference of the posted artifact, used later to route outcome signals
     * @throws PostFailureException if the artifact could not be posted
     */
    String postArtifact(Wager wager) throws PostFailureException;

    List<Destination> listDestinations(String groupId);

    /**
     * @throws NoticeDeliveryException if the notice could not be delivered
     */
    void publishNotice(String destination, String message);
}
