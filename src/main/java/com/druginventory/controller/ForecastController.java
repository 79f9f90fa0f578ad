package com.druginventory.controller;

import com.druginventory.config.ForecastConfigResolver;
import com.druginventory.config.RequestIdFilter;
import com.druginventory.dto.AccuracyRequest;
import com.druginventory.dto.DemandHistoryRequest;
import com.druginventory.dto.DemandHistoryResponse;
import com.druginventory.dto.ForecastRequest;
import com.druginventory.dto.PortfolioForecastRequest;
import com.druginventory.exception.DrugProfileNotFoundException;
import com.druginventory.model.AccuracyReport;
import com.druginventory.model.ForecastConfig;
import com.druginventory.model.ForecastResult;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.PortfolioForecast;
import com.druginventory.service.ForecastAccuracyService;
import com.druginventory.service.InventoryForecastService;
import com.druginventory.service.PortfolioForecastService;
import com.druginventory.service.RegimeClassifier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/forecasts")
@RequiredArgsConstructor
public class ForecastController {

    private final InventoryForecastService forecastService;
    private final PortfolioForecastService portfolioService;
    private final ForecastAccuracyService accuracyService;
    private final RegimeClassifier regimeClassifier;
    private final ForecastConfigResolver configResolver;

    @PostMapping
    public ResponseEntity<ForecastResult> forecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        ForecastConfig config = configResolver.resolve(request.getConfig());
        ForecastResult result = forecastService.generateForecast(
                request.profile(), request.getBatches(), request.getMovements(), config,
                request.getStoredModel(), request.getPreviousState())
            .orElseThrow(() -> new DrugProfileNotFoundException(request.profile()));
        log.info("POST /forecasts | profile={} | method={} | risk={} | requestId={}",
            request.profile().key(), result.getMethod(), result.getRiskLevel(),
            RequestIdFilter.requestIdOf(httpRequest));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/portfolio")
    public ResponseEntity<PortfolioForecast> portfolio(
            @Valid @RequestBody PortfolioForecastRequest request, HttpServletRequest httpRequest) {
        PortfolioForecast portfolio = portfolioService.forecastPortfolio(
            request.getBatches(), request.getMovements(), configResolver.resolve(request.getConfig()));
        log.info("POST /forecasts/portfolio | profiles={} | requestId={}",
            portfolio.getProfileCount(), RequestIdFilter.requestIdOf(httpRequest));
        return ResponseEntity.ok(portfolio);
    }

    @PostMapping("/demand-history")
    public ResponseEntity<DemandHistoryResponse> demandHistory(@Valid @RequestBody DemandHistoryRequest request) {
        List<HistoricalDemandPoint> series = forecastService.demandHistory(
            request.profile(), request.getBatches(), request.getMovements());
        return ResponseEntity.ok(DemandHistoryResponse.builder()
            .profileKey(request.profile().key())
            .historyDays(series.size())
            .totalStockOut(series.stream().mapToLong(HistoricalDemandPoint::getStockOutVolume).sum())
            .series(series)
            .markovState(regimeClassifier.classify(series, request.getPreviousState()))
            .build());
    }

    @PostMapping("/accuracy")
    public ResponseEntity<AccuracyReport> accuracy(@Valid @RequestBody AccuracyRequest request) {
        double threshold = request.getRetrainThreshold() != null
            ? request.getRetrainThreshold()
            : configResolver.resolve(null).getRetrainThreshold();
        return ResponseEntity.ok(accuracyService.evaluate(
            request.getPredictions(), request.getActuals(), request.getPreviousError(), threshold));
    }
}
