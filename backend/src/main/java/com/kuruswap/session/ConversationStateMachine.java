package com.kuruswap.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.chain.TokenMetadata;
import com.kuruswap.common.InputValidator;
import com.kuruswap.common.KeyedLocks;
import com.kuruswap.common.KuruSwapException;
import com.kuruswap.common.NotFoundException;
import com.kuruswap.common.ValidationException;
import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.market.NoPoolException;
import com.kuruswap.market.PoolResolver;
import com.kuruswap.swap.SwapOrchestrator;
import com.kuruswap.swap.SwapReceipt;
import com.kuruswap.swap.SwapRequest;
import com.kuruswap.wallet.ProvisionedWallet;
import com.kuruswap.wallet.WalletBalance;
import com.kuruswap.wallet.WalletProvisioningService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

import static com.kuruswap.session.ConversationState.AWAITING_SWAP_CONFIRMATION;
import static com.kuruswap.session.ConversationState.AWAITING_TOKEN_ADDRESS;
import static com.kuruswap.session.ConversationState.AWAITING_WALLET_NAME;
import static com.kuruswap.session.ConversationState.IDLE;

/**
 * Multi-step conversations (create wallet, import wallet, swap) for a messaging front end.
 * <p>
 * One session row per user in a short-lived table. Menu actions start a conversation only from
 * {@link ConversationState#IDLE}; {@link SessionInput.Cancel} works from any state. Invalid text keeps the
 * current state and reports a rejection. Network failures propagate and leave the session as it was.
 */
@Service
@Slf4j
public class ConversationStateMachine {

    private final Cache<Long, ConversationSession> sessions;
    private final WalletProvisioningService walletProvisioningService;
    private final EvmChainClient chainClient;
    private final PoolResolver poolResolver;
    private final SwapOrchestrator swapOrchestrator;
    private final InputValidator inputValidator;
    private final KeyedLocks<Long> userLocks = new KeyedLocks<>();

    public ConversationStateMachine(
            Cache<Long, ConversationSession> conversationSessions,
            WalletProvisioningService walletProvisioningService,
            EvmChainClient chainClient,
            PoolResolver poolResolver,
            SwapOrchestrator swapOrchestrator,
            InputValidator inputValidator
    ) {
        this.sessions = conversationSessions;
        this.walletProvisioningService = walletProvisioningService;
        this.chainClient = chainClient;
        this.poolResolver = poolResolver;
        this.swapOrchestrator = swapOrchestrator;
        this.inputValidator = inputValidator;
    }

    public SessionResult handle(long userId, String displayName, SessionInput input) {
        return userLocks.withLock(userId, () -> {
            if (input instanceof SessionInput.Cancel) {
                sessions.invalidate(userId);
                return SessionResult.of(SessionEvent.CANCELLED, IDLE);
            }
            ConversationSession session = sessions.getIfPresent(userId);
            if (session == null) {
                return handleIdle(userId, input);
            }
            if (input instanceof SessionInput.TextEntered text) {
                return handleText(session, displayName, text.text() == null ? "" : text.text().strip());
            }
            if (input instanceof SessionInput.ConfirmSwap && session.state() == AWAITING_SWAP_CONFIRMATION) {
                return confirmSwap(session);
            }
            return SessionResult.rejected(SessionEvent.UNEXPECTED_INPUT, session.state(),
                    "Not expected while " + session.state());
        });
    }

    public ConversationState currentState(long userId) {
        ConversationSession session = sessions.getIfPresent(userId);
        return session == null ? IDLE : session.state();
    }

    private SessionResult handleIdle(long userId, SessionInput input) {
        if (input instanceof SessionInput.StartCreateWallet) {
            sessions.put(userId, ConversationSession.start(userId, PendingAction.CREATE_WALLET, AWAITING_WALLET_NAME));
            return SessionResult.of(SessionEvent.WALLET_NAME_REQUESTED, AWAITING_WALLET_NAME);
        }
        if (input instanceof SessionInput.StartImportWallet) {
            sessions.put(userId, ConversationSession.start(userId, PendingAction.IMPORT_WALLET, AWAITING_WALLET_NAME));
            return SessionResult.of(SessionEvent.WALLET_NAME_REQUESTED, AWAITING_WALLET_NAME);
        }
        if (input instanceof SessionInput.StartSwap) {
            return startSwap(userId);
        }
        return SessionResult.rejected(SessionEvent.UNEXPECTED_INPUT, IDLE, "No conversation in progress");
    }

    private SessionResult startSwap(long userId) {
        WalletBalance balance;
        try {
            balance = walletProvisioningService.getActiveWalletBalance(userId);
        } catch (NotFoundException e) {
            return SessionResult.rejected(SessionEvent.NO_ACTIVE_WALLET, IDLE, e.getMessage());
        }
        if (balance.balance().signum() <= 0) {
            return new SessionResult(SessionEvent.INSUFFICIENT_BALANCE, IDLE, "Wallet " + balance.name() + " has no balance", balance);
        }
        sessions.put(userId, ConversationSession.start(userId, PendingAction.SWAP, AWAITING_TOKEN_ADDRESS));
        return SessionResult.of(SessionEvent.TOKEN_ADDRESS_REQUESTED, AWAITING_TOKEN_ADDRESS, balance);
    }

    private SessionResult handleText(ConversationSession session, String displayName, String text) {
        switch (session.state()) {
            case AWAITING_WALLET_NAME:
                return onWalletName(session, displayName, text);
            case AWAITING_PRIVATE_KEY:
                return onPrivateKey(session, displayName, text);
            case AWAITING_TOKEN_ADDRESS:
                return onTokenAddress(session, text);
            case AWAITING_SWAP_AMOUNT:
                return onSwapAmount(session, text);
            default:
                return SessionResult.rejected(SessionEvent.UNEXPECTED_INPUT, session.state(),
                        "Text not expected while " + session.state());
        }
    }

    private SessionResult onWalletName(ConversationSession session, String displayName, String text) {
        String name;
        try {
            name = inputValidator.requireWalletName(text);
        } catch (ValidationException e) {
            return SessionResult.rejected(SessionEvent.INVALID_WALLET_NAME, session.state(), e.getMessage());
        }
        if (session.action() == PendingAction.IMPORT_WALLET) {
            ConversationSession next = session.awaitingPrivateKey(name);
            sessions.put(session.userId(), next);
            return SessionResult.of(SessionEvent.PRIVATE_KEY_REQUESTED, next.state());
        }
        ProvisionedWallet wallet = walletProvisioningService.createWallet(session.userId(), displayName, name);
        sessions.invalidate(session.userId());
        return SessionResult.of(SessionEvent.WALLET_CREATED, IDLE, wallet);
    }

    private SessionResult onPrivateKey(ConversationSession session, String displayName, String text) {
        CustodyWallet wallet;
        try {
            wallet = walletProvisioningService.importWallet(session.userId(), displayName, session.walletName(), text);
        } catch (ValidationException e) {
            return SessionResult.rejected(SessionEvent.INVALID_PRIVATE_KEY, session.state(), e.getMessage());
        }
        sessions.invalidate(session.userId());
        return SessionResult.of(SessionEvent.WALLET_IMPORTED, IDLE, wallet);
    }

    private SessionResult onTokenAddress(ConversationSession session, String text) {
        TokenMetadata token;
        try {
            String address = inputValidator.requireTokenAddress(text);
            token = chainClient.getTokenMetadata(address);
        } catch (ValidationException e) {
            return SessionResult.rejected(SessionEvent.INVALID_TOKEN, session.state(), e.getMessage());
        }
        String pool;
        try {
            pool = poolResolver.resolve(InputValidator.NATIVE_ASSET, token.address());
        } catch (NoPoolException e) {
            sessions.invalidate(session.userId());
            return new SessionResult(SessionEvent.NO_POOL, IDLE, e.getMessage(), token);
        }
        ConversationSession next = session.awaitingAmount(token, pool);
        sessions.put(session.userId(), next);
        return SessionResult.of(SessionEvent.SWAP_AMOUNT_REQUESTED, next.state(), token);
    }

    private SessionResult onSwapAmount(ConversationSession session, String text) {
        BigDecimal amount;
        try {
            amount = inputValidator.parseAmount(text);
        } catch (ValidationException e) {
            return SessionResult.rejected(SessionEvent.INVALID_AMOUNT, session.state(), e.getMessage());
        }
        WalletBalance balance;
        try {
            balance = walletProvisioningService.getActiveWalletBalance(session.userId());
        } catch (NotFoundException e) {
            sessions.invalidate(session.userId());
            return SessionResult.rejected(SessionEvent.NO_ACTIVE_WALLET, IDLE, e.getMessage());
        }
        if (amount.compareTo(balance.balance()) > 0) {
            return new SessionResult(SessionEvent.INSUFFICIENT_BALANCE, session.state(),
                    "Amount " + amount.toPlainString() + " exceeds balance " + balance.balance().toPlainString(), balance);
        }
        ConversationSession next = session.awaitingConfirmation(amount);
        sessions.put(session.userId(), next);
        return SessionResult.of(SessionEvent.SWAP_CONFIRMATION_REQUESTED, next.state(), next);
    }

    private SessionResult confirmSwap(ConversationSession session) {
        sessions.invalidate(session.userId());
        try {
            SwapReceipt receipt = swapOrchestrator.execute(
                    new SwapRequest(session.userId(), session.token().address(), session.amount()));
            return SessionResult.of(SessionEvent.SWAP_SUBMITTED, IDLE, receipt);
        } catch (KuruSwapException e) {
            log.warn("Swap for user {} failed ({}): {}", session.userId(), e.getKind(), e.getMessage());
            return new SessionResult(SessionEvent.SWAP_FAILED, IDLE, e.getMessage(), e.getKind());
        }
    }
}
