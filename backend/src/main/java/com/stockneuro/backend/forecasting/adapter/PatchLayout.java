package com.stockneuro.backend.forecasting.adapter;

/**
 * Patch segmentation of a window. The window is padded at the end with {@code stride}
 * copies of its last value before patching.
 */
public record PatchLayout(int patchLength, int stride, int patchCount) {

    public static PatchLayout forInput(int inputLength, int patchLength, int stride) {
        int effectivePatch = Math.max(1, Math.min(patchLength, inputLength));
        int effectiveStride = Math.max(1, Math.min(stride, effectivePatch));
        int padded = inputLength + effectiveStride;
        int count = (padded - effectivePatch) / effectiveStride + 1;
        return new PatchLayout(effectivePatch, effectiveStride, count);
    }

    public double[][] segment(double[] values) {
        double[] padded = new double[values.length + stride];
        System.arraycopy(values, 0, padded, 0, values.length);
        for (int i = values.length; i < padded.length; i++) {
            padded[i] = values[values.length - 1];
        }
        double[][] patches = new double[patchCount][patchLength];
        for (int p = 0; p < patchCount; p++) {
            System.arraycopy(padded, p * stride, patches[p], 0, patchLength);
        }
        return patches;
    }
}
