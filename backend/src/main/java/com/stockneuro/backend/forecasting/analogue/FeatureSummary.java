package com.stockneuro.backend.forecasting.analogue;

/**
 * Scale-free shape descriptor of a price window.
 *
 * @param trendSlope least-squares slope per step, relative to the mean price
 */
public record FeatureSummary(
        double volatility,
        double trendSlope,
        double meanReturn,
        double skewness,
        double kurtosis,
        double maxDrawdown
) {

    public static final int DIMENSIONS = 6;

    public double[] toArray() {
        return new double[]{volatility, trendSlope, meanReturn, skewness, kurtosis, maxDrawdown};
    }

    public static FeatureSummary of(double[] prices) {
        if (prices.length < 3) {
            throw new IllegalArgumentException("At least 3 prices are needed for a feature summary");
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            double previous = prices[i - 1];
            returns[i - 1] = previous == 0.0 ? 0.0 : (prices[i] - previous) / previous;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        for (double r : returns) {
            double d = r - mean;
            m2 += d * d;
            m3 += d * d * d;
            m4 += d * d * d * d;
        }
        m2 /= returns.length;
        m3 /= returns.length;
        m4 /= returns.length;
        double std = Math.sqrt(m2);
        double skew = std > 0.0 ? m3 / (std * std * std) : 0.0;
        double kurt = m2 > 0.0 ? m4 / (m2 * m2) - 3.0 : 0.0;

        double priceMean = 0.0;
        for (double p : prices) {
            priceMean += p;
        }
        priceMean /= prices.length;
        double xMean = (prices.length - 1) / 2.0;
        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < prices.length; i++) {
            covariance += (i - xMean) * (prices[i] - priceMean);
            varianceX += (i - xMean) * (i - xMean);
        }
        double slope = priceMean == 0.0 ? 0.0 : covariance / varianceX / Math.abs(priceMean);

        double peak = prices[0];
        double drawdown = 0.0;
        for (double p : prices) {
            peak = Math.max(peak, p);
            if (peak > 0.0) {
                drawdown = Math.max(drawdown, (peak - p) / peak);
            }
        }
        return new FeatureSummary(std, slope, mean, skew, kurt, drawdown);
    }
}
