package com.flagship.wager_ledger.wizard;

import lombok.Value;

import java.util.UUID;

@Value
public class SessionHandle {
    UUID sessionId;
    String ownerId;
}
