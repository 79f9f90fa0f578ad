package com.druginventory.service;

import com.druginventory.exception.InventoryInputException;
import com.druginventory.model.DrugProfile;
import com.druginventory.model.ExpiryWarning;
import com.druginventory.model.ForecastConfig;
import com.druginventory.model.ForecastMethod;
import com.druginventory.model.ForecastResult;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.InventoryBatch;
import com.druginventory.model.MarkovState;
import com.druginventory.model.PredictionPoint;
import com.druginventory.model.ReservoirModel;
import com.druginventory.model.RiskLevel;
import com.druginventory.model.StockMovement;
import com.druginventory.reservoir.ReservoirForecaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Expiry-aware demand forecast for a single drug profile. Stateless: any model or regime carried
 * between calls is supplied by the caller and returned as a new value.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryForecastService {

    static final int MIN_RESERVOIR_HISTORY = 3;

    private final DrugGroupingService groupingService;
    private final DemandHistoryAggregator historyAggregator;
    private final RegimeClassifier regimeClassifier;
    private final ReservoirForecaster reservoirForecaster;
    private final RiskReorderCalculator riskCalculator;
    private final Clock clock;

    public Optional<ForecastResult> generateForecast(DrugProfile profile, List<InventoryBatch> batches,
                                                     List<StockMovement> movements,
                                                     ForecastConfig config) {
        return generateForecast(profile, batches, movements, config, null, null);
    }

    /**
     * @return empty when no batch belongs to {@code profile}
     */
    public Optional<ForecastResult> generateForecast(DrugProfile profile, List<InventoryBatch> batches,
                                                     List<StockMovement> movements,
                                                     ForecastConfig config, ReservoirModel storedModel,
                                                     MarkovState previousState) {
        validate(config);
        List<InventoryBatch> profileBatches = groupingService.batchesOf(batches, profile);
        if (profileBatches.isEmpty()) {
            log.debug("No batches for profile | profile={}", profile.key());
            return Optional.empty();
        }

        InventoryBatch representative = profileBatches.get(0);
        int currentStock = profileBatches.stream().mapToInt(InventoryBatch::getQuantity).sum();
        LocalDate today = LocalDate.now(clock);

        List<HistoricalDemandPoint> series = historyAggregator.buildDailySeries(movements, batches, profile);
        MarkovState regime = regimeClassifier.classify(series, previousState);
        List<ExpiryWarning> warnings = riskCalculator.expiryWarnings(profileBatches, today);

        ForecastResult.ForecastResultBuilder result = ForecastResult.builder()
            .drugId(representative.getId())
            .genericName(profile.getGenericName())
            .brandName(profile.getBrandName())
            .strength(profile.getStrength())
            .currentStock(currentStock)
            .expiryWarnings(warnings)
            .markovState(regime)
            .historyDays(series.size());

        List<PredictionPoint> predictions;
        int safetyStock;
        int reorderPoint;
        double confidence;
        if (series.size() < MIN_RESERVOIR_HISTORY) {
            double dailyDemand = riskCalculator.fallbackDemand(series);
            predictions = riskCalculator.fallbackPredictions(dailyDemand, currentStock,
                config.getForecastHorizon(), today);
            safetyStock = riskCalculator.fallbackSafetyStock(dailyDemand, config);
            reorderPoint = riskCalculator.fallbackReorderPoint(dailyDemand, safetyStock, config);
            confidence = riskCalculator.fallbackConfidence();
            result.method(ForecastMethod.FALLBACK);
            log.info("Fallback forecast | profile={} | historyDays={} | dailyDemand={}",
                profile.key(), series.size(), dailyDemand);
        } else {
            ReservoirForecaster.ReservoirRun run = reservoirForecaster.forecast(
                series, currentStock, config, storedModel, today);
            predictions = run.predictions();
            safetyStock = riskCalculator.safetyStock(predictions, config);
            reorderPoint = riskCalculator.reorderPoint(predictions, safetyStock, config);
            confidence = riskCalculator.modelConfidence(series.size());
            result.method(ForecastMethod.RESERVOIR).model(run.model());
            log.info("Reservoir forecast | profile={} | historyDays={} | trainingRmse={}",
                profile.key(), series.size(), run.model().getLastError());
        }

        RiskLevel risk = riskCalculator.riskLevel(currentStock, reorderPoint, predictions, warnings);

        return Optional.of(result
            .predictions(predictions)
            .safetyStock(safetyStock)
            .reorderPoint(reorderPoint)
            .nextRestockDate(riskCalculator.nextRestockDate(predictions, reorderPoint))
            .riskLevel(risk)
            .modelConfidence(confidence)
            .build());
    }

    public List<HistoricalDemandPoint> demandHistory(DrugProfile profile, List<InventoryBatch> batches,
                                                     List<StockMovement> movements) {
        return historyAggregator.buildDailySeries(movements, batches, profile);
    }

    void validate(ForecastConfig config) {
        if (config == null) {
            throw new InventoryInputException("forecast config is required");
        }
        if (config.getReservoirSize() < 1) {
            throw new InventoryInputException("reservoirSize must be >= 1");
        }
        if (config.getForecastHorizon() < 1) {
            throw new InventoryInputException("forecastHorizon must be >= 1");
        }
        if (config.getLeakingRate() <= 0.0 || config.getLeakingRate() > 1.0) {
            throw new InventoryInputException("leakingRate must be in (0, 1]");
        }
        if (config.getSpectralRadius() <= 0.0) {
            throw new InventoryInputException("spectralRadius must be > 0");
        }
        if (config.getReservoirDensity() <= 0.0 || config.getReservoirDensity() > 1.0) {
            throw new InventoryInputException("reservoirDensity must be in (0, 1]");
        }
        if (config.getServiceLevel() <= 0.0 || config.getServiceLevel() >= 1.0) {
            throw new InventoryInputException("serviceLevel must be strictly between 0 and 1");
        }
        if (config.getLeadTimeDays() < 1) {
            throw new InventoryInputException("leadTimeDays must be >= 1");
        }
        if (config.getInputScaling() < 0.0 || config.getSafetyStockMultiplier() < 0.0
                || config.getRidgeRegularization() < 0.0) {
            throw new InventoryInputException(
                "inputScaling, safetyStockMultiplier and ridgeRegularization must be >= 0");
        }
    }
}
