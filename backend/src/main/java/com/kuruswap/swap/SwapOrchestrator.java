package com.kuruswap.swap;

import com.kuruswap.chain.ChainProperties;
import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.common.InputValidator;
import com.kuruswap.common.InsufficientBalanceException;
import com.kuruswap.common.KeyedLocks;
import com.kuruswap.common.SubmissionException;
import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.domain.TransactionStatus;
import com.kuruswap.domain.TransactionType;
import com.kuruswap.ledger.LedgerStore;
import com.kuruswap.market.PoolResolver;
import com.kuruswap.quote.Quote;
import com.kuruswap.quote.QuoteEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Sells the native asset for a token from the user's active wallet.
 * <p>
 * Order: validate, balance check, pool, quote, then build, sign, submit and record under a per-wallet
 * lock. Any failure aborts with one typed exception; nothing is persisted unless the network accepted
 * the transaction.
 */
@Service
@Slf4j
public class SwapOrchestrator {

    private final LedgerStore ledgerStore;
    private final EvmChainClient chainClient;
    private final PoolResolver poolResolver;
    private final QuoteEngine quoteEngine;
    private final SwapTransactionBuilder transactionBuilder;
    private final InputValidator inputValidator;
    private final ChainProperties chainProperties;
    private final KeyedLocks<String> submissionLocks = new KeyedLocks<>();

    public SwapOrchestrator(
            LedgerStore ledgerStore,
            EvmChainClient chainClient,
            PoolResolver poolResolver,
            QuoteEngine quoteEngine,
            SwapTransactionBuilder transactionBuilder,
            InputValidator inputValidator,
            ChainProperties chainProperties
    ) {
        this.ledgerStore = ledgerStore;
        this.chainClient = chainClient;
        this.poolResolver = poolResolver;
        this.quoteEngine = quoteEngine;
        this.transactionBuilder = transactionBuilder;
        this.inputValidator = inputValidator;
        this.chainProperties = chainProperties;
    }

    public SwapReceipt execute(SwapRequest request) {
        String tokenAddress = inputValidator.requireTokenAddress(request.tokenAddress());
        inputValidator.requirePositiveAmount(request.amountNative());
        CustodyWallet wallet = ledgerStore.getActiveWallet(request.userId());
        return execute(wallet, tokenAddress, request.amountNative());
    }

    public SwapReceipt execute(CustodyWallet wallet, String tokenAddress, BigDecimal amountNative) {
        String token = inputValidator.requireTokenAddress(tokenAddress);
        BigInteger amountWei = inputValidator.toSmallestUnit(amountNative);

        BigInteger balanceWei = chainClient.getNativeBalanceWei(wallet.getAddress());
        if (amountWei.compareTo(balanceWei) > 0) {
            throw new InsufficientBalanceException("Amount " + amountNative.toPlainString()
                    + " exceeds balance " + new BigDecimal(balanceWei, InputValidator.NATIVE_DECIMALS).toPlainString());
        }

        String pool = poolResolver.resolve(InputValidator.NATIVE_ASSET, token);
        Quote quote = quoteEngine.quote(pool, amountWei);

        Submission submission = submissionLocks.withLock(wallet.getAddress().toLowerCase(), () -> {
            RawTransaction transaction = transactionBuilder.build(wallet.getAddress(), pool, token, amountWei, quote.minOutput());
            String hash = chainClient.sendSignedTransaction(sign(transaction, wallet));
            log.info("Swap submitted: wallet={} pool={} amount={} minOut={} tx={}",
                    wallet.getId(), pool, amountNative.toPlainString(), quote.minOutput(), hash);
            return new Submission(hash, record(wallet, hash, amountNative, token));
        });

        return new SwapReceipt(
                submission.txHash(),
                chainProperties.getExplorerTxUrl() + submission.txHash(),
                wallet.getId(),
                wallet.getAddress(),
                token,
                pool,
                amountNative,
                quote.minOutput(),
                submission.recorded());
    }

    /**
     * Runs after the network accepted the transaction; a failure is logged and reported, not thrown.
     */
    private boolean record(CustodyWallet wallet, String txHash, BigDecimal amountNative, String token) {
        try {
            ledgerStore.appendTransaction(wallet, txHash, TransactionType.SWAP, amountNative.toPlainString(), token,
                    TransactionStatus.PENDING);
            return true;
        } catch (RuntimeException e) {
            log.error("Swap {} was submitted but could not be recorded for wallet {}", txHash, wallet.getId(), e);
            return false;
        }
    }

    private String sign(RawTransaction transaction, CustodyWallet wallet) {
        Credentials credentials = Credentials.create(ledgerStore.revealSecret(wallet));
        if (!credentials.getAddress().equalsIgnoreCase(wallet.getAddress())) {
            throw new SubmissionException("Stored key for wallet " + wallet.getId() + " does not match its address");
        }
        byte[] signed = TransactionEncoder.signMessage(transaction, chainProperties.getChainId(), credentials);
        return Numeric.toHexString(signed);
    }

    private record Submission(String txHash, boolean recorded) {
    }
}
