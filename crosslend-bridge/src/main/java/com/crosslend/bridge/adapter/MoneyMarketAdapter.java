package com.crosslend.bridge.adapter;

import com.crosslend.bridge.config.BridgeProperties;
import com.crosslend.bridge.payload.LiquidityInstruction;
import com.crosslend.bridge.payload.LiquidityInstructionCodec;
import com.crosslend.bridge.transport.BridgeCall;
import com.crosslend.bridge.transport.BridgeTransport;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint16;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Talks to an Aave-style lending pool instead of a bridge. The "chain selector" is the pool address
 * on that chain, and the payload must be a {@link LiquidityInstruction}: RELEASE becomes a variable
 * rate {@code borrow} on behalf of the account, REPAY becomes {@code repay}. No bridge fee applies.
 */
public class MoneyMarketAdapter extends AbstractBridgeAdapter<String> {

  public static final String PROTOCOL = "money-market";

  private static final long VARIABLE_RATE_MODE = 2L;

  private final int referralCode;

  public MoneyMarketAdapter(@NonNull BridgeProperties.MoneyMarket config, @NonNull BridgeTransport transport, RetryPolicy retry) {
    super(PROTOCOL, poolTable(config.pools()), transport, retry, FeeSchedule.free());
    this.referralCode = config.referralCode();
  }

  @Override
  protected String dispatch(OutboundMessage<String> message) {
    LiquidityInstruction instruction;
    try {
      instruction = LiquidityInstructionCodec.decode(message.payload());
    } catch (IllegalArgumentException e) {
      throw new LendingException(ErrorCode.INVALID_STATE, "money market payload is not a liquidity instruction", e);
    }
    Function call = switch (instruction.action()) {
      case RELEASE -> new Function(
          "borrow",
          List.of(
              new Address(instruction.asset()),
              new Uint256(instruction.amount()),
              new Uint256(VARIABLE_RATE_MODE),
              new Uint16(referralCode),
              new Address(instruction.account())),
          List.of());
      case REPAY -> new Function(
          "repay",
          List.of(
              new Address(instruction.asset()),
              new Uint256(instruction.amount()),
              new Uint256(VARIABLE_RATE_MODE),
              new Address(instruction.account())),
          List.of());
      default -> throw new LendingException(ErrorCode.INVALID_STATE,
          "money market cannot act on " + instruction.action());
    };
    return submitWithRetry(new BridgeCall(getProtocolName(), message.selector(), FunctionEncoder.encode(call), BigInteger.ZERO));
  }

  private static ChainSelectorTable<String> poolTable(Map<String, String> pools) {
    Map<String, String> normalized = new LinkedHashMap<>();
    pools.forEach((chain, pool) -> normalized.put(chain, Assets.normalize(pool)));
    return ChainSelectorTable.of(normalized);
  }
}
