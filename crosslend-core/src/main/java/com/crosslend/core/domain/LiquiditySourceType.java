package com.crosslend.core.domain;

public enum LiquiditySourceType {
  LOCAL_VAULT,
  CROSS_CHAIN_BRIDGE,
  EXTERNAL_MONEY_MARKET
}
