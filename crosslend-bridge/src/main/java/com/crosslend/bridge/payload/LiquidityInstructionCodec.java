package com.crosslend.bridge.payload;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * ABI codec for {@link LiquidityInstruction}:
 * <pre>
 * abi.encode(uint8 action, bytes32 requestId, address account, address asset, uint256 amount)
 * </pre>
 * Matches what the remote vault contracts decode in their receive hooks.
 */
public final class LiquidityInstructionCodec {

  private static final List<TypeReference<Type>> LAYOUT = Utils.convert(Arrays.<TypeReference<?>>asList(
      new TypeReference<Uint8>() {
      },
      new TypeReference<Bytes32>() {
      },
      new TypeReference<Address>() {
      },
      new TypeReference<Address>() {
      },
      new TypeReference<Uint256>() {
      }
  ));

  private static final int ENCODED_LENGTH = 32 * 5;

  private LiquidityInstructionCodec() {
  }

  public static byte[] encode(LiquidityInstruction instruction) {
    List<Type> values = List.of(
        new Uint8(instruction.action().ordinal()),
        new Bytes32(Numeric.toBytesPadded(Numeric.toBigInt(orZero(instruction.requestId())), 32)),
        new Address(instruction.account()),
        new Address(instruction.asset()),
        new Uint256(instruction.amount())
    );
    return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(values));
  }

  public static LiquidityInstruction decode(byte[] payload) {
    if (payload == null || payload.length != ENCODED_LENGTH) {
      throw new IllegalArgumentException("liquidity instruction must be " + ENCODED_LENGTH + " bytes, got "
          + (payload == null ? 0 : payload.length));
    }
    List<Type> decoded = FunctionReturnDecoder.decode(Numeric.toHexString(payload), LAYOUT);
    int action = ((BigInteger) decoded.get(0).getValue()).intValueExact();
    LiquidityInstruction.Action[] actions = LiquidityInstruction.Action.values();
    if (action < 0 || action >= actions.length) {
      throw new IllegalArgumentException("unknown instruction action " + action);
    }
    return new LiquidityInstruction(
        actions[action],
        Numeric.toHexString((byte[]) decoded.get(1).getValue()),
        (String) decoded.get(2).getValue(),
        (String) decoded.get(3).getValue(),
        (BigInteger) decoded.get(4).getValue()
    );
  }

  private static String orZero(String hex) {
    return hex == null || hex.isBlank() ? "0x0" : hex;
  }
}
