package com.dispatchsentinel.job;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.model.DelayEvent;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads the dispatch dataset from a CSV file with a header row.
 *
 * <p>
 * Rows are read as string maps with Jackson CSV and converted to
 * {@link DelayEvent}s by {@link EventRowMapper}. Which columns hold the
 * identifier, timestamp, delay and label is taken from
 * {@link PipelineConfig#getSchema()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DispatchCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchCsvReader.class);

    private final CsvMapper mapper = new CsvMapper();
    private final PipelineConfig config;

    public DispatchCsvReader(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
    }

    /**
     * @param path the CSV file
     * @return the loaded dataset
     * @throws UncheckedIOException if the file is missing or unreadable
     */
    public Dataset read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.info("Loading dataset from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            Dataset dataset = read(in);
            LOG.info("Loaded {} event(s) with columns {}", dataset.size(), dataset.getColumns());
            return dataset;
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("Dataset not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param in CSV content; not closed by this method
     * @return the loaded dataset
     * @throws IOException if the content cannot be parsed as CSV
     */
    public Dataset read(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(in);

        List<Map<String, String>> rows = new ArrayList<>();
        Set<String> header = new LinkedHashSet<>();
        while (it.hasNext()) {
            Map<String, String> row = new LinkedHashMap<>(it.next());
            header.addAll(row.keySet());
            rows.add(row);
        }
        List<String> columns = new ArrayList<>(header);

        EventRowMapper rowMapper = new EventRowMapper(config.getSchema(), entityKeyColumns(), columns);
        List<DelayEvent> events = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            events.add(rowMapper.map(rows.get(i), i));
        }

        if (rowMapper.getLabelColumn() == null) {
            LOG.info("No label column among {}; running unlabelled", config.getSchema().getLabelColumns());
        }
        if (rowMapper.getTimestampFailures() > 0) {
            LOG.warn("{} timestamp value(s) could not be parsed and were treated as missing",
                    rowMapper.getTimestampFailures());
        }
        if (rowMapper.getDelayFailures() > 0) {
            LOG.warn("{} delay value(s) could not be parsed", rowMapper.getDelayFailures());
        }
        return new Dataset(columns, rows, events);
    }

    private List<String> entityKeyColumns() {
        Set<String> keys = new LinkedHashSet<>(config.getEntityKeys());
        keys.addAll(config.getZscoreKeys());
        return new ArrayList<>(keys);
    }
}
