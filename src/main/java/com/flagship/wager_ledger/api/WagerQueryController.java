package com.flagship.wager_ledger.api;

import com.flagship.wager_ledger.api.dto.NetUnitsResponse;
import com.flagship.wager_ledger.api.dto.WagerResponse;
import com.flagship.wager_ledger.ledger.WagerLedger;
import com.flagship.wager_ledger.ledger.WagerNotFoundException;
import com.flagship.wager_ledger.settlement.SettlementEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/wagers")
@RequiredArgsConstructor
public class WagerQueryController {

    private final WagerLedger ledger;
    private final SettlementEngine settlementEngine;

    @GetMapping("/{id}")
    public ResponseEntity<WagerResponse> getWager(@PathVariable("id") UUID id) {
        return ledger.findById(id)
            .map(wager -> ResponseEntity.ok(WagerResponse.from(wager,
                    ledger.findSettlementRecords(id), ledger.findSettlementAudit(id))))
            .orElseThrow(() -> new WagerNotFoundException(id));
    }

    /**
     * Net units for one owner in one group, over settlements recorded in [from, to).
     */
    @GetMapping("/units")
    public ResponseEntity<NetUnitsResponse> netUnits(
            @RequestParam("owner_id") String ownerId,
            @RequestParam("group_id") String groupId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        BigDecimal net = settlementEngine.netUnits(ownerId, groupId, from, to);
        return ResponseEntity.ok(new NetUnitsResponse(ownerId, groupId, from, to, net));
    }
}
