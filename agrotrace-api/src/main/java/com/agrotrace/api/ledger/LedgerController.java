package com.agrotrace.api.ledger;

import com.agrotrace.api.web.ApiResponses;
import com.agrotrace.api.web.ApiResult;
import com.agrotrace.api.web.CallerHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Local ledger balances and owner deposits.
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * GET /api/v1/ledger/accounts/{account}
     */
    @GetMapping("/accounts/{account}")
    public ResponseEntity<ApiResult<AccountBalance>> getBalance(@PathVariable String account) {
        return ResponseEntity.ok(ApiResult.ok(new AccountBalance(account, ledgerService.balanceOf(account))));
    }

    /**
     * Registry owner funds an account.
     * POST /api/v1/ledger/accounts/{account}/deposits
     */
    @PostMapping("/accounts/{account}/deposits")
    public ResponseEntity<ApiResult<BigInteger>> deposit(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable String account,
            @RequestBody DepositRequest request) {
        return ApiResponses.of(ledgerService.deposit(callerId, account, request.amount()));
    }

    public record AccountBalance(String account, BigInteger balance) {}

    public record DepositRequest(BigInteger amount) {}
}
