package com.narrativeplatform.common.classifier;

import com.narrativeplatform.common.model.MarketBias;
import com.narrativeplatform.common.model.SignalStrength;

public record Classification(MarketBias bias, SignalStrength strength) {}
