package com.chainbills.ledger.service;

import com.chainbills.ledger.config.LedgerProperties;
import com.chainbills.ledger.crosschain.ActionType;
import com.chainbills.ledger.crosschain.AttestedMessage;
import com.chainbills.ledger.crosschain.CrossChainMessageValidator;
import com.chainbills.ledger.crosschain.VerifiedMessage;
import com.chainbills.ledger.dto.PayableResponse;
import com.chainbills.ledger.dto.TokenAndAmountDto;
import com.chainbills.ledger.entity.ChainStats;
import com.chainbills.ledger.entity.CounterScope;
import com.chainbills.ledger.entity.Payable;
import com.chainbills.ledger.entity.TokenAndAmount;
import com.chainbills.ledger.entity.User;
import com.chainbills.ledger.event.PayableAllowedTokensUpdatedEvent;
import com.chainbills.ledger.event.PayableClosedEvent;
import com.chainbills.ledger.event.PayableCreatedEvent;
import com.chainbills.ledger.event.PayableReopenedEvent;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.PayableRepository;
import com.chainbills.ledger.util.EntityKind;
import com.chainbills.ledger.util.HexUtils;
import com.chainbills.ledger.util.IdUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Payable registry.
 *
 * Responsibilities:
 *  - Creates payables for local hosts and, from attested messages, for hosts on other chains.
 *  - Validates descriptions and allowed tokens-and-amounts (capacity, positive amounts, supported tokens).
 *  - Host-only close / reopen / allowed-set replacement.
 *  - Loads payables under a row lock for the payment and withdrawal paths.
 *
 * Notes:
 *  - Each public mutation is one transaction: counters, stats, user and payable rows commit together.
 *  - Closing only blocks new payments. Balances stay withdrawable.
 */
@Service
@Slf4j
public class PayableService {

    private final PayableRepository payableRepo;
    private final ChainStatsService chainStatsService;
    private final UserService userService;
    private final CounterRegistry counters;
    private final TokenRegistry tokenRegistry;
    private final AddressService addressService;
    private final CrossChainMessageValidator validator;
    private final ApplicationEventPublisher events;
    private final int maxTokensAndAmounts;
    private final int maxDescriptionLength;

    public PayableService(PayableRepository payableRepo,
                          ChainStatsService chainStatsService,
                          UserService userService,
                          CounterRegistry counters,
                          TokenRegistry tokenRegistry,
                          AddressService addressService,
                          CrossChainMessageValidator validator,
                          ApplicationEventPublisher events,
                          LedgerProperties properties) {
        this.payableRepo = payableRepo;
        this.chainStatsService = chainStatsService;
        this.userService = userService;
        this.counters = counters;
        this.tokenRegistry = tokenRegistry;
        this.addressService = addressService;
        this.validator = validator;
        this.events = events;
        this.maxTokensAndAmounts = properties.getMaxTokensAndAmounts();
        this.maxDescriptionLength = properties.getMaxDescriptionLength();
    }

    /**
     * Creates a payable hosted by a wallet of this chain.
     *
     * @param host        calling wallet, local form
     * @param description free text, trimmed
     * @param allowed     allowed tokens and amounts; empty accepts any supported token
     * @return the created payable
     */
    @Transactional
    public PayableResponse createPayable(String host, String description, List<TokenAndAmountDto> allowed) {
        String wallet = addressService.normalizeLocal(host);
        log.info("[PAYABLE] Start create. host={}, allowed={}", wallet, allowed == null ? 0 : allowed.size());

        List<TokenAndAmount> entries = new ArrayList<>();
        if (allowed != null) {
            for (TokenAndAmountDto dto : allowed) {
                entries.add(new TokenAndAmount(dto.getToken(), dto.getAmount() == null ? 0L : dto.getAmount()));
            }
        }
        String checkedDescription = validateDescription(description);
        List<TokenAndAmount> checked = validateAllowed(entries);

        Payable saved = doCreate(chainStatsService.getChainId(), wallet, checkedDescription, checked);
        return PayableResponse.from(saved);
    }

    /**
     * Creates a payable whose host lives on the message's emitter chain.
     *
     * @param message attested CREATE_PAYABLE message
     * @param caller  remote host as named by the relayer, 32-byte form
     */
    @Transactional
    public PayableResponse createPayableReceived(AttestedMessage message, String caller) {
        log.info("[PAYABLE] Start create from message. key={}", message.guardKey());
        VerifiedMessage verified = validator.verify(message, ActionType.CREATE_PAYABLE, caller);

        List<TokenAndAmount> entries = new ArrayList<>();
        for (TokenAndAmount taa : verified.getPayload().getTokensAndAmounts()) {
            entries.add(new TokenAndAmount(localToken(taa.getToken()), taa.getAmount()));
        }
        String checkedDescription = validateDescription(verified.getPayload().getDescription());
        List<TokenAndAmount> checked = validateAllowed(entries);

        Payable saved = doCreate(verified.getEmitterChainId(), verified.getCaller(), checkedDescription, checked);
        validator.markApplied(verified, saved.getId());
        return PayableResponse.from(saved);
    }

    @Transactional
    public PayableResponse closePayable(String payableId, String caller) {
        Payable payable = requireLocalHost(payableId, caller);
        applyClosed(payable, true);
        return PayableResponse.from(payable);
    }

    @Transactional
    public PayableResponse reopenPayable(String payableId, String caller) {
        Payable payable = requireLocalHost(payableId, caller);
        applyClosed(payable, false);
        return PayableResponse.from(payable);
    }

    @Transactional
    public PayableResponse closePayableReceived(AttestedMessage message, String caller, String payableId) {
        return applyClosedReceived(message, ActionType.CLOSE_PAYABLE, caller, payableId, true);
    }

    @Transactional
    public PayableResponse reopenPayableReceived(AttestedMessage message, String caller, String payableId) {
        return applyClosedReceived(message, ActionType.REOPEN_PAYABLE, caller, payableId, false);
    }

    /**
     * Replaces the allowed set. Balances accumulated under the previous set are untouched.
     */
    @Transactional
    public PayableResponse updateAllowedTokensAndAmounts(String payableId, String caller,
                                                         List<TokenAndAmountDto> allowed) {
        Payable payable = requireLocalHost(payableId, caller);

        List<TokenAndAmount> entries = new ArrayList<>();
        for (TokenAndAmountDto dto : allowed) {
            entries.add(new TokenAndAmount(dto.getToken(), dto.getAmount() == null ? 0L : dto.getAmount()));
        }
        List<TokenAndAmount> checked = validateAllowed(entries);

        payable.getAllowedTokensAndAmounts().clear();
        payable.getAllowedTokensAndAmounts().addAll(checked);
        log.info("[PAYABLE] Allowed tokens updated. payableId={}, allowed={}", payable.getId(), checked.size());
        events.publishEvent(new PayableAllowedTokensUpdatedEvent(payable.getId(), checked.size()));
        return PayableResponse.from(payable);
    }

    /**
     * Loads a payable with a write lock held until the caller's transaction ends.
     *
     * @throws LedgerException INVALID_PAYABLE_ID if absent
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payable requirePayableForUpdate(String payableId) {
        if (payableId == null || payableId.isBlank()) {
            throw new LedgerException(LedgerError.INVALID_PAYABLE_ID, "Payable id is required");
        }
        String id = "0x" + HexUtils.strip(payableId);
        return payableRepo.findForUpdate(id)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_PAYABLE_ID, "Payable not found: " + id));
    }

    // ---------- Helpers ----------

    private Payable doCreate(int hostChainId, String host, String description, List<TokenAndAmount> allowed) {
        ChainStats stats = chainStatsService.loadForUpdate();
        User user = userService.loadOrInitialize(stats, hostChainId, host);

        long chainCount = counters.next(CounterScope.CHAIN_PAYABLES, CounterRegistry.chainScope(stats.getChainId()));
        long hostCount = counters.next(CounterScope.USER_PAYABLES, CounterRegistry.userScope(hostChainId, host));
        stats.setPayablesCount(chainCount);
        user.setPayablesCount(hostCount);

        Payable payable = new Payable();
        payable.setId(IdUtils.create(EntityKind.PAYABLE, hostChainId, addressService.toUniversal(host), hostCount));
        payable.setChainCount(chainCount);
        payable.setHost(host);
        payable.setHostChainId(hostChainId);
        payable.setHostCount(hostCount);
        payable.setDescription(description);
        payable.getAllowedTokensAndAmounts().addAll(allowed);
        Payable saved = payableRepo.save(payable);

        log.info("[PAYABLE] Completed create. payableId={}, host={}@{}, chainCount={}, hostCount={}",
                saved.getId(), host, hostChainId, chainCount, hostCount);
        events.publishEvent(new PayableCreatedEvent(saved.getId(), host, hostChainId, chainCount, hostCount));
        return saved;
    }

    private PayableResponse applyClosedReceived(AttestedMessage message, ActionType action, String caller,
                                                String payableId, boolean closed) {
        log.info("[PAYABLE] Start {} from message. key={}, payableId={}", action, message.guardKey(), payableId);
        VerifiedMessage verified = validator.verify(message, action, caller);
        validator.requireMatchingPayable(verified, payableId);
        Payable payable = requirePayableForUpdate(payableId);
        validator.requireHost(verified, payable);

        applyClosed(payable, closed);
        validator.markApplied(verified, payable.getId());
        return PayableResponse.from(payable);
    }

    private void applyClosed(Payable payable, boolean closed) {
        payable.setClosed(closed);
        if (closed) {
            log.info("[PAYABLE] Closed. payableId={}", payable.getId());
            events.publishEvent(new PayableClosedEvent(payable.getId(), payable.getHost()));
        } else {
            log.info("[PAYABLE] Reopened. payableId={}", payable.getId());
            events.publishEvent(new PayableReopenedEvent(payable.getId(), payable.getHost()));
        }
    }

    private Payable requireLocalHost(String payableId, String caller) {
        String wallet = addressService.normalizeLocal(caller);
        Payable payable = requirePayableForUpdate(payableId);
        if (!payable.isHostedBy(chainStatsService.getChainId(), wallet)) {
            log.warn("[PAYABLE] Rejected non-host caller. payableId={}, caller={}", payable.getId(), wallet);
            throw new LedgerException(LedgerError.NOT_YOUR_PAYABLE,
                    "Wallet " + wallet + " does not host payable " + payable.getId());
        }
        return payable;
    }

    private String validateDescription(String description) {
        String trimmed = description == null ? "" : description.trim();
        if (trimmed.isEmpty()) {
            throw new LedgerException(LedgerError.EMPTY_DESCRIPTION_PROVIDED);
        }
        if (trimmed.length() > maxDescriptionLength) {
            throw new LedgerException(LedgerError.MAX_PAYABLE_DESCRIPTION_REACHED,
                    "Description exceeds " + maxDescriptionLength + " characters");
        }
        return trimmed;
    }

    /**
     * Checks capacity, then each entry's amount and token.
     * Returns normalized entries without duplicates, in request order.
     */
    private List<TokenAndAmount> validateAllowed(List<TokenAndAmount> entries) {
        if (entries.size() > maxTokensAndAmounts) {
            throw new LedgerException(LedgerError.MAX_PAYABLE_TOKENS_CAPACITY_REACHED,
                    "At most " + maxTokensAndAmounts + " tokens and amounts are allowed");
        }
        Set<TokenAndAmount> checked = new LinkedHashSet<>();
        for (TokenAndAmount taa : entries) {
            if (taa.getAmount() <= 0) {
                throw new LedgerException(LedgerError.ZERO_AMOUNT_SPECIFIED,
                        "Allowed amount must be positive for token " + taa.getToken());
            }
            checked.add(new TokenAndAmount(tokenRegistry.requireSupported(taa.getToken()), taa.getAmount()));
        }
        return new ArrayList<>(checked);
    }

    private String localToken(String universalToken) {
        try {
            return addressService.toLocal(universalToken);
        } catch (LedgerException e) {
            throw new LedgerException(LedgerError.INVALID_TOKEN, "Invalid token: " + universalToken, e);
        }
    }
}
