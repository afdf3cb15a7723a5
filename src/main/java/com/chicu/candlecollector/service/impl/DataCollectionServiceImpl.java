package com.chicu.candlecollector.service.impl;

import com.chicu.candlecollector.config.CollectorProperties;
import com.chicu.candlecollector.engine.CollectionJob;
import com.chicu.candlecollector.engine.CollectionScheduler;
import com.chicu.candlecollector.engine.JobRegistry;
import com.chicu.candlecollector.engine.TriggerResult;
import com.chicu.candlecollector.market.store.CandleStore;
import com.chicu.candlecollector.market.store.CollectionStats;
import com.chicu.candlecollector.service.DataCollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class DataCollectionServiceImpl implements DataCollectionService {

    private final CollectionScheduler scheduler;
    private final JobRegistry registry;
    private final CandleStore store;
    private final JdbcTemplate jdbcTemplate;
    private final CollectorProperties props;

    // =====================================================================
    // ЗАПУСК
    // =====================================================================

    @Override
    public TriggerResult triggerCurrentCollection() {
        return scheduler.trigger(CollectionJob.CURRENT);
    }

    @Override
    public TriggerResult triggerHistoricalCollection() {
        return scheduler.trigger(CollectionJob.HISTORICAL);
    }

    // =====================================================================
    // СТАТУС
    // =====================================================================

    @Override
    public SchedulerStatus getJobStatus() {
        return new SchedulerStatus(scheduler.isRunning(), registry.snapshot());
    }

    @Override
    public CollectionStats getCollectionStats() {
        return store.collectionStats();
    }

    @Override
    public DatabaseStatus checkDatabase() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return new DatabaseStatus(true, null);
        } catch (DataAccessException e) {
            log.warn("🗄 БД недоступна: {}", e.getMessage());
            return new DatabaseStatus(false, e.getMessage());
        }
    }

    /**
     * Лог-файлы каталога collector.log-dir, свежие первыми.
     */
    @Override
    public List<LogFileInfo> getLogFiles() {
        Path dir = Paths.get(props.getLogDir());
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        List<LogFileInfo> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                out.add(new LogFileInfo(
                        p.getFileName().toString(),
                        Files.size(p),
                        Files.getLastModifiedTime(p).toInstant()
                ));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list log files in " + dir, e);
        }

        out.sort(Comparator.comparing(LogFileInfo::modifiedAt).reversed());
        return out;
    }
}
