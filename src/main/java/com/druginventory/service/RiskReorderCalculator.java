package com.druginventory.service;

import com.druginventory.model.ExpiryWarning;
import com.druginventory.model.ForecastConfig;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.InventoryBatch;
import com.druginventory.model.PredictionPoint;
import com.druginventory.model.RiskLevel;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replenishment policy derived from a rolled-forward forecast: safety stock, reorder point,
 * restock date, expiry exposure and an ordinal risk level. Also owns the flat fallback forecast
 * used when history is too short for the reservoir.
 */
@Service
public class RiskReorderCalculator {

    static final int EXPIRY_WARNING_DAYS = 90;
    static final int CRITICAL_EXPIRY_DAYS = 30;
    static final int HIGH_EXPIRY_DAYS = 60;
    static final int HIGH_DEPLETION_DAYS = 7;
    static final int MEDIUM_DEPLETION_DAYS = 14;
    static final double FALLBACK_CONFIDENCE = 30.0;
    static final double FULL_CONFIDENCE_HISTORY_DAYS = 30.0;

    public int safetyStock(List<PredictionPoint> predictions, ForecastConfig config) {
        if (predictions.isEmpty()) {
            return 0;
        }
        double mean = predictions.stream().mapToDouble(PredictionPoint::getPredictedDemand).average().orElse(0.0);
        double variance = predictions.stream()
            .mapToDouble(p -> (p.getPredictedDemand() - mean) * (p.getPredictedDemand() - mean))
            .average()
            .orElse(0.0);
        double zScore = config.getServiceLevel() >= 0.95 ? 1.65 : 1.28;
        return (int) Math.ceil(zScore * Math.sqrt(variance) * Math.sqrt(config.getLeadTimeDays())
            * config.getSafetyStockMultiplier());
    }

    /** A flat forecast has no spread, so the buffer is sized from lead-time demand instead. */
    public int fallbackSafetyStock(double meanDemand, ForecastConfig config) {
        return (int) Math.ceil(meanDemand * config.getLeadTimeDays() * config.getSafetyStockMultiplier());
    }

    /**
     * Predicted demand over the first lead-time days plus safety stock. Days past the horizon count as zero,
     * so a horizon shorter than the lead time is not extrapolated.
     */
    public int reorderPoint(List<PredictionPoint> predictions, int safetyStock, ForecastConfig config) {
        double leadTimeDemand = predictions.stream()
            .limit(config.getLeadTimeDays())
            .mapToDouble(PredictionPoint::getPredictedDemand)
            .sum();
        return (int) Math.ceil(leadTimeDemand + safetyStock);
    }

    /** Flat daily demand projected across the full lead time plus safety stock. */
    public int fallbackReorderPoint(double dailyDemand, int safetyStock, ForecastConfig config) {
        return (int) Math.ceil(dailyDemand * config.getLeadTimeDays() + safetyStock);
    }

    /** Dated batches expiring strictly between today and 90 days out, soonest first. */
    public List<ExpiryWarning> expiryWarnings(List<InventoryBatch> profileBatches, LocalDate today) {
        List<ExpiryWarning> warnings = new ArrayList<>();
        for (InventoryBatch batch : profileBatches) {
            if (batch.getExpiryDate() == null) {
                continue;
            }
            long days = ChronoUnit.DAYS.between(today, batch.getExpiryDate());
            if (days > 0 && days < EXPIRY_WARNING_DAYS) {
                warnings.add(ExpiryWarning.builder()
                    .batchId(batch.getId())
                    .batchNumber(batch.getBatchNumber())
                    .expiryDate(batch.getExpiryDate())
                    .quantity(batch.getQuantity())
                    .daysUntilExpiry(days)
                    .build());
            }
        }
        warnings.sort(Comparator.comparingLong(ExpiryWarning::getDaysUntilExpiry));
        return warnings;
    }

    public LocalDate nextRestockDate(List<PredictionPoint> predictions, int reorderPoint) {
        return predictions.stream()
            .filter(p -> p.getStockLevel() <= reorderPoint)
            .map(PredictionPoint::getDate)
            .findFirst()
            .orElse(null);
    }

    public RiskLevel riskLevel(int currentStock, int reorderPoint,
                               List<PredictionPoint> predictions, List<ExpiryWarning> warnings) {
        if (currentStock < reorderPoint || expiresWithin(warnings, CRITICAL_EXPIRY_DAYS)) {
            return RiskLevel.CRITICAL;
        }
        if (depletesWithin(predictions, reorderPoint, HIGH_DEPLETION_DAYS)
                || expiresWithin(warnings, HIGH_EXPIRY_DAYS)) {
            return RiskLevel.HIGH;
        }
        if (depletesWithin(predictions, reorderPoint, MEDIUM_DEPLETION_DAYS)) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    /** Grows linearly with observed demand days and saturates at 100 after a month. */
    public double modelConfidence(int historyDays) {
        return Math.min(100.0, historyDays / FULL_CONFIDENCE_HISTORY_DAYS * 100.0);
    }

    public double fallbackConfidence() {
        return FALLBACK_CONFIDENCE;
    }

    /** Mean daily outbound volume, or 1 unit/day for a profile with no recorded demand. */
    public double fallbackDemand(List<HistoricalDemandPoint> series) {
        return series.isEmpty() ? 1.0
            : series.stream().mapToInt(HistoricalDemandPoint::getStockOutVolume).average().orElse(1.0);
    }

    public List<PredictionPoint> fallbackPredictions(double dailyDemand, int currentStock,
                                                     int horizon, LocalDate startDate) {
        List<PredictionPoint> predictions = new ArrayList<>(horizon);
        double stock = currentStock;
        for (int day = 0; day < horizon; day++) {
            stock = Math.max(0.0, stock - dailyDemand);
            predictions.add(PredictionPoint.builder()
                .date(startDate.plusDays(day))
                .predictedDemand(dailyDemand)
                .confidenceLower(dailyDemand * 0.5)
                .confidenceUpper(dailyDemand * 1.5)
                .stockLevel(stock)
                .build());
        }
        return predictions;
    }

    private boolean expiresWithin(List<ExpiryWarning> warnings, int days) {
        return warnings.stream().anyMatch(w -> w.getDaysUntilExpiry() < days);
    }

    private boolean depletesWithin(List<PredictionPoint> predictions, int reorderPoint, int days) {
        return predictions.stream().limit(days).anyMatch(p -> p.getStockLevel() <= reorderPoint);
    }
}
