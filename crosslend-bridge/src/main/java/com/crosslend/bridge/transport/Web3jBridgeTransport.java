package com.crosslend.bridge.transport;

import com.crosslend.bridge.config.BridgeProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * LIVE transport: signs bridge calls with the configured relayer key and broadcasts them through
 * JSON-RPC, waiting for the receipt. Only failures before {@code eth_sendRawTransaction} succeeds
 * are retryable.
 */
@RequiredArgsConstructor
@Slf4j
public class Web3jBridgeTransport implements BridgeTransport {

  private final @NonNull BridgeProperties.Onchain onchain;

  private volatile Web3j web3j;
  private volatile Credentials signer;

  Web3jBridgeTransport(BridgeProperties.Onchain onchain, Web3j web3j, Credentials signer) {
    this.onchain = onchain;
    this.web3j = web3j;
    this.signer = signer;
  }

  private Web3j web3j() {
    Web3j existing = web3j;
    if (existing != null) {
      return existing;
    }
    synchronized (this) {
      if (web3j == null) {
        web3j = Web3j.build(new HttpService(onchain.rpcUrl().toString()));
      }
      return web3j;
    }
  }

  private Credentials signer() {
    Credentials existing = signer;
    if (existing != null) {
      return existing;
    }
    synchronized (this) {
      if (signer == null) {
        String key = onchain.signerPrivateKey();
        if (key == null || key.isBlank()) {
          throw new IllegalStateException("bridge.onchain.signer-private-key is required in LIVE mode");
        }
        signer = Credentials.create(key.trim());
      }
      return signer;
    }
  }

  @Override
  public String submit(BridgeCall call) {
    try {
      return sendAndConfirm(call);
    } catch (IOException e) {
      throw new RetryableBridgeException("bridge tx failed protocol=" + call.protocol() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for bridge tx", e);
    }
  }

  @Override
  public Optional<BigInteger> quoteFee(BridgeCall quoteCall) {
    try {
      Transaction tx = Transaction.createEthCallTransaction(signer().getAddress(), quoteCall.target(), quoteCall.calldata());
      EthCall response = web3j().ethCall(tx, DefaultBlockParameterName.LATEST).send();
      if (response.hasError() || response.isReverted() || response.getValue() == null || "0x".equals(response.getValue())) {
        return Optional.empty();
      }
      return Optional.of(Numeric.toBigInt(response.getValue()));
    } catch (Exception e) {
      log.debug("fee quote failed protocol={} target={} err={}", quoteCall.protocol(), quoteCall.target(), e.toString());
      return Optional.empty();
    }
  }

  private String sendAndConfirm(BridgeCall call) throws IOException, InterruptedException {
    Credentials credentials = signer();
    String from = credentials.getAddress();

    BigInteger gasPrice = resolveGasPrice();
    BigInteger gasLimit = resolveGasLimit(from, call);

    RawTransaction rawTx = RawTransaction.createTransaction(
        resolveNonce(from),
        gasPrice,
        gasLimit,
        call.target(),
        call.value(),
        call.calldata()
    );

    byte[] signed = TransactionEncoder.signMessage(rawTx, onchain.chainId(), credentials);
    EthSendTransaction send = web3j().ethSendRawTransaction(Numeric.toHexString(signed)).send();
    if (send.hasError()) {
      throw new IOException("eth_sendRawTransaction error: " + send.getError().getMessage());
    }

    String txHash = send.getTransactionHash();
    log.info("bridge tx sent (protocol={}, hash={}, gasPrice={}, gasLimit={})", call.protocol(), txHash, gasPrice, gasLimit);

    TransactionReceipt receipt;
    try {
      receipt = waitForReceipt(txHash);
    } catch (IOException e) {
      throw new BroadcastUnconfirmedException(txHash,
          "bridge tx broadcast but unconfirmed protocol=" + call.protocol() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BroadcastUnconfirmedException(txHash,
          "interrupted while waiting for receipt protocol=" + call.protocol(), e);
    }
    String status = receipt.getStatus();
    if (status != null && status.equalsIgnoreCase("0x0")) {
      // a revert is deterministic; retrying the same calldata would revert again
      throw new IllegalStateException("bridge tx reverted (hash=" + txHash + ")");
    }
    log.info("bridge tx confirmed (protocol={}, hash={}, status={})", call.protocol(), txHash, status);
    return txHash;
  }

  private BigInteger resolveNonce(String from) throws IOException {
    return web3j().ethGetTransactionCount(from, DefaultBlockParameterName.PENDING)
        .send()
        .getTransactionCount();
  }

  private BigInteger resolveGasPrice() throws IOException {
    EthGasPrice gasPrice = web3j().ethGasPrice().send();
    BigInteger base = gasPrice.getGasPrice();
    BigDecimal scaled = new BigDecimal(base).multiply(BigDecimal.valueOf(onchain.gasPriceMultiplier()));
    return scaled.setScale(0, RoundingMode.CEILING).toBigIntegerExact();
  }

  private BigInteger resolveGasLimit(String from, BridgeCall call) {
    BigInteger fallback = BigInteger.valueOf(onchain.fallbackGasLimit());
    try {
      Transaction tx = Transaction.createFunctionCallTransaction(from, null, null, null, call.target(), call.value(), call.calldata());
      EthEstimateGas estimate = web3j().ethEstimateGas(tx).send();
      if (estimate.hasError() || estimate.getAmountUsed() == null) {
        return fallback;
      }
      BigDecimal scaled = new BigDecimal(estimate.getAmountUsed()).multiply(BigDecimal.valueOf(onchain.gasLimitMultiplier()));
      BigInteger limit = scaled.setScale(0, RoundingMode.CEILING).toBigIntegerExact();
      return limit.max(BigInteger.valueOf(21_000L));
    } catch (Exception e) {
      log.debug("gas estimation failed protocol={} err={}", call.protocol(), e.toString());
      return fallback;
    }
  }

  private TransactionReceipt waitForReceipt(String txHash) throws IOException, InterruptedException {
    long sleepMillis = onchain.receiptPollIntervalMillis();
    int attempts = onchain.receiptPollAttempts();

    for (int i = 0; i < attempts; i++) {
      EthGetTransactionReceipt resp = web3j().ethGetTransactionReceipt(txHash).send();
      Optional<TransactionReceipt> receipt = resp.getTransactionReceipt();
      if (receipt.isPresent()) {
        return receipt.get();
      }
      Thread.sleep(sleepMillis);
    }

    throw new IOException("timed out waiting for receipt (hash=" + txHash + ", waited=" +
        Duration.ofMillis(sleepMillis * (long) attempts) + ")");
  }
}
