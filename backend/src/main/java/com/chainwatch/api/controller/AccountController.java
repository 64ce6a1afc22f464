package com.chainwatch.api.controller;

import com.chainwatch.domain.EthBalance;
import com.chainwatch.domain.GasEstimate;
import com.chainwatch.domain.TokenBalance;
import com.chainwatch.ingestion.account.AccountQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * GET /account/balance, /account/gas, /account/tokens for the configured wallet.
 * The provider clients block, so each query runs on the bounded-elastic scheduler instead of an event-loop thread.
 */
@RestController
@RequestMapping("/api/v1/account")
@RequiredArgsConstructor
public class AccountController {

    private final AccountQueryService accountQueryService;

    @GetMapping("/balance")
    public Mono<EthBalance> balance() {
        return Mono.fromCallable(accountQueryService::ethBalance).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/gas")
    public Mono<GasEstimate> gas() {
        return Mono.fromCallable(accountQueryService::gasEstimate).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tokens")
    public Mono<List<TokenBalance>> tokens(@RequestParam(required = false) String subscriber) {
        return Mono.fromCallable(() -> accountQueryService.tokenBalances(subscriber))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
