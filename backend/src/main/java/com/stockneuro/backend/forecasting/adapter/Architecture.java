package com.stockneuro.backend.forecasting.adapter;

public enum Architecture {
    LSTM,
    RNN,
    PATCH_TST,
    ZERO_SHOT,
    STATE_SPACE
}
