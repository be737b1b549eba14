package com.flagship.wager_ledger.presenter;

import lombok.Value;

@Value
public class Destination {
    String id;
    String name;
}
