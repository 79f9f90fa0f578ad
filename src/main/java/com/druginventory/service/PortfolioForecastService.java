package com.druginventory.service;

import com.druginventory.model.AtRiskDrug;
import com.druginventory.model.DrugProfile;
import com.druginventory.model.ForecastConfig;
import com.druginventory.model.ForecastResult;
import com.druginventory.model.InventoryBatch;
import com.druginventory.model.PortfolioForecast;
import com.druginventory.model.RiskLevel;
import com.druginventory.model.StockMovement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Forecasts every drug profile held in inventory and ranks the ones most in need of attention.
 */
@Slf4j
@Service
public class PortfolioForecastService {

    private final DrugGroupingService groupingService;
    private final InventoryForecastService forecastService;
    private final Clock clock;
    private final int topAtRisk;

    public PortfolioForecastService(DrugGroupingService groupingService,
                                    InventoryForecastService forecastService,
                                    Clock clock,
                                    @Value("${inventory.portfolio.top-at-risk:6}") int topAtRisk) {
        this.groupingService = groupingService;
        this.forecastService = forecastService;
        this.clock = clock;
        this.topAtRisk = topAtRisk;
    }

    public PortfolioForecast forecastPortfolio(List<InventoryBatch> batches, List<StockMovement> movements,
                                               ForecastConfig config) {
        LocalDate today = LocalDate.now(clock);
        List<ForecastResult> forecasts = new ArrayList<>();
        List<AtRiskDrug> ranked = new ArrayList<>();

        for (Map.Entry<DrugProfile, List<InventoryBatch>> entry : groupingService.partition(batches).entrySet()) {
            Optional<ForecastResult> forecast = forecastService.generateForecast(
                entry.getKey(), batches, movements, config);
            if (forecast.isEmpty()) {
                continue;
            }
            forecasts.add(forecast.get());
            AtRiskDrug scored = score(forecast.get(), entry.getValue(), today);
            if (scored.getRiskScore() > 0) {
                ranked.add(scored);
            }
        }

        List<AtRiskDrug> atRisk = ranked.stream()
            .sorted(Comparator.comparingInt(AtRiskDrug::getRiskScore).reversed())
            .limit(Math.max(0, topAtRisk))
            .toList();
        int criticalOrHigh = (int) forecasts.stream()
            .filter(f -> f.getRiskLevel() == RiskLevel.CRITICAL || f.getRiskLevel() == RiskLevel.HIGH)
            .count();
        double averageConfidence = forecasts.stream()
            .mapToDouble(ForecastResult::getModelConfidence)
            .average()
            .orElse(0.0);

        log.info("Portfolio forecast | profiles={} | criticalOrHigh={} | atRisk={}",
            forecasts.size(), criticalOrHigh, atRisk.size());

        return PortfolioForecast.builder()
            .generatedAt(clock.instant())
            .profileCount(forecasts.size())
            .criticalOrHighCount(criticalOrHigh)
            .averageModelConfidence(round(averageConfidence))
            .atRisk(atRisk)
            .forecasts(forecasts)
            .build();
    }

    /**
     * Risk level points, plus proximity of the earliest-expiring batch, plus proximity of the restock date.
     */
    AtRiskDrug score(ForecastResult forecast, List<InventoryBatch> profileBatches, LocalDate today) {
        int score = forecast.getRiskLevel().getScorePoints();

        InventoryBatch mostCritical = profileBatches.stream()
            .min(InventoryBatch.FEFO_ORDER)
            .orElse(null);
        if (mostCritical != null && mostCritical.getExpiryDate() != null) {
            score += proximityPoints(ChronoUnit.DAYS.between(today, mostCritical.getExpiryDate()), 30, 60, 90);
        }
        if (forecast.getNextRestockDate() != null) {
            score += proximityPoints(ChronoUnit.DAYS.between(today, forecast.getNextRestockDate()), 7, 14, 21);
        }

        return AtRiskDrug.builder()
            .genericName(forecast.getGenericName())
            .brandName(forecast.getBrandName())
            .strength(forecast.getStrength())
            .riskLevel(forecast.getRiskLevel())
            .riskScore(score)
            .currentStock(forecast.getCurrentStock())
            .reorderPoint(forecast.getReorderPoint())
            .mostCriticalBatchNumber(mostCritical != null ? mostCritical.getBatchNumber() : null)
            .mostCriticalExpiry(mostCritical != null ? mostCritical.getExpiryDate() : null)
            .nextRestockDate(forecast.getNextRestockDate())
            .build();
    }

    private int proximityPoints(long days, int near, int mid, int far) {
        if (days <= near) {
            return 30;
        }
        if (days <= mid) {
            return 20;
        }
        if (days <= far) {
            return 10;
        }
        return 0;
    }

    private double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
