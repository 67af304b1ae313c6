package com.wagerdesk.ledger.service;

import com.wagerdesk.ledger.dto.CalibrationReport;
import com.wagerdesk.ledger.dto.CalibrationReport.BucketRow;
import com.wagerdesk.ledger.model.CalibrationBucket;
import com.wagerdesk.ledger.model.LossAnalysis;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.repository.CalibrationBucketRepository;
import com.wagerdesk.ledger.repository.LossAnalysisRepository;
import com.wagerdesk.ledger.repository.WagerRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
public class CalibrationService {

    private final CalibrationBucketRepository calibrationRepository;
    private final WagerRepository wagerRepository;
    private final LossAnalysisRepository lossRepository;

    public CalibrationService(CalibrationBucketRepository calibrationRepository,
                              WagerRepository wagerRepository,
                              LossAnalysisRepository lossRepository) {
        this.calibrationRepository = calibrationRepository;
        this.wagerRepository       = wagerRepository;
        this.lossRepository        = lossRepository;
    }

    /**
     * Stated vs. realized win rate per bucket, with overall accuracy and unit-stake profit.
     */
    public Mono<CalibrationReport> report() {
        return Mono.zip(calibrationRepository.findAllOrdered().collectList(),
                        wagerRepository.findSettled().collectList())
            .map(tuple -> build(tuple.getT1(), tuple.getT2()));
    }

    public Flux<LossAnalysis> recentLosses(int limit) {
        return lossRepository.findRecent(limit);
    }

    static CalibrationReport build(List<CalibrationBucket> buckets, List<Wager> settled) {
        List<BucketRow> rows = buckets.stream()
            .map(b -> new BucketRow(b.getBucket(), b.expectedWinRate(), b.getActualWinRate(), b.getCalibrationError(),
                                    b.getTotalBets(), b.getWins(), b.getLosses(), b.getPushes()))
            .toList();

        int wins = buckets.stream().mapToInt(CalibrationBucket::getWins).sum();
        int losses = buckets.stream().mapToInt(CalibrationBucket::getLosses).sum();
        Double accuracy = wins + losses == 0 ? null : (double) wins / (wins + losses);

        double profit = settled.stream()
            .filter(w -> w.getProfit() != null)
            .mapToDouble(Wager::getProfit)
            .sum();
        double roi = settled.isEmpty() ? 0.0 : profit / settled.size();

        return new CalibrationReport(rows, settled.size(), accuracy, round(profit), round(roi));
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
