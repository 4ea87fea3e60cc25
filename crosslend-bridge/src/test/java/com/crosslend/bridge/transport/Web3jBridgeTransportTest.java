package com.crosslend.bridge.transport;

import com.crosslend.bridge.config.BridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Web3jBridgeTransportTest {

  private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
  private static final String TX_HASH = "0x5e1f7c0b9d6a4e3f2a1b0c9d8e7f6a5b4c3d2e1f0a9b8c7d6e5f4a3b2c1d0e9f";
  private static final BridgeCall CALL = new BridgeCall("ccip",
      "0x80226fc0ee2b096224eeac085bb9a8cba1146f7d", "0x96f4e9f9", BigInteger.TEN);

  private final BridgeProperties.Onchain onchain =
      new BridgeProperties.Onchain(null, 137L, null, null, null, null, 0L, 3);
  private final Web3j web3j = mock(Web3j.class);
  private final Web3jBridgeTransport transport = new Web3jBridgeTransport(onchain, web3j, Credentials.create(KEY));

  @BeforeEach
  void setUp() throws IOException {
    EthGasPrice gasPrice = new EthGasPrice();
    gasPrice.setResult("0x3b9aca00");
    doReturn(request(gasPrice)).when(web3j).ethGasPrice();

    EthEstimateGas estimate = new EthEstimateGas();
    estimate.setResult("0x30d40");
    doReturn(request(estimate)).when(web3j).ethEstimateGas(any(Transaction.class));

    EthGetTransactionCount nonce = new EthGetTransactionCount();
    nonce.setResult("0x7");
    doReturn(request(nonce)).when(web3j).ethGetTransactionCount(anyString(), any(DefaultBlockParameter.class));
  }

  @Test
  void returnsHashOnceReceiptArrives() throws IOException {
    acceptBroadcast();
    TransactionReceipt receipt = new TransactionReceipt();
    receipt.setStatus("0x1");
    EthGetTransactionReceipt found = new EthGetTransactionReceipt();
    found.setResult(receipt);
    doReturn(request(found)).when(web3j).ethGetTransactionReceipt(TX_HASH);

    assertThat(transport.submit(CALL)).isEqualTo(TX_HASH);
  }

  @Test
  void missingReceiptAfterBroadcastIsNotRetryable() throws IOException {
    acceptBroadcast();
    doReturn(request(new EthGetTransactionReceipt())).when(web3j).ethGetTransactionReceipt(TX_HASH);

    assertThatThrownBy(() -> transport.submit(CALL))
        .isInstanceOf(BroadcastUnconfirmedException.class)
        .isNotInstanceOf(RetryableBridgeException.class)
        .satisfies(e -> assertThat(((BroadcastUnconfirmedException) e).txHash()).isEqualTo(TX_HASH));
    verify(web3j, times(1)).ethSendRawTransaction(anyString());
    verify(web3j, times(3)).ethGetTransactionReceipt(TX_HASH);
  }

  @Test
  void rejectedBroadcastIsRetryable() throws IOException {
    EthSendTransaction rejected = new EthSendTransaction();
    rejected.setError(new Response.Error(-32000, "nonce too low"));
    doReturn(request(rejected)).when(web3j).ethSendRawTransaction(anyString());

    assertThatThrownBy(() -> transport.submit(CALL))
        .isInstanceOf(RetryableBridgeException.class)
        .hasMessageContaining("nonce too low");
  }

  @Test
  void revertedTxFailsWithoutRetry() throws IOException {
    acceptBroadcast();
    TransactionReceipt receipt = new TransactionReceipt();
    receipt.setStatus("0x0");
    EthGetTransactionReceipt found = new EthGetTransactionReceipt();
    found.setResult(receipt);
    doReturn(request(found)).when(web3j).ethGetTransactionReceipt(TX_HASH);

    assertThatThrownBy(() -> transport.submit(CALL))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining(TX_HASH);
  }

  private void acceptBroadcast() throws IOException {
    EthSendTransaction sent = new EthSendTransaction();
    sent.setResult(TX_HASH);
    doReturn(request(sent)).when(web3j).ethSendRawTransaction(anyString());
  }

  @SuppressWarnings("unchecked")
  private static <T extends Response<?>> Request<?, T> request(T response) throws IOException {
    Request<?, T> request = mock(Request.class);
    when(request.send()).thenReturn(response);
    return request;
  }
}
