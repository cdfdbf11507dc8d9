package com.liquiditysentinel.core.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.liquiditysentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Renders analytics results as JSON for a presentation layer.
 *
 * <p>
 * Handles {@link com.liquiditysentinel.core.model.Alert},
 * {@link com.liquiditysentinel.core.model.RegimeResult},
 * {@link com.liquiditysentinel.core.derived.DiagnosticBundle},
 * {@link com.liquiditysentinel.core.derived.IdentityCheck} and collections of
 * them. Dates and instants are written as ISO-8601 strings. A
 * {@link TimeSeries} is written as its name and a list of
 * {@code {date, value}} points, with missing values as {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportSerializer.class);

    private final ObjectMapper mapper;

    public ReportSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new SimpleModule("liquidity-sentinel")
                .addSerializer(TimeSeries.class, new TimeSeriesSerializer()));
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param value result to render
     * @return compact JSON
     * @throws IllegalStateException if the value cannot be serialized
     */
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", describe(value), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize " + describe(value), e);
        }
    }

    /**
     * @param value result to render
     * @return indented JSON
     * @throws IllegalStateException if the value cannot be serialized
     */
    public String toPrettyJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", describe(value), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize " + describe(value), e);
        }
    }

    /**
     * @return the configured mapper, for callers that need to read back JSON
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    // ---------------------------------------------------------------
    // TimeSeries
    // ---------------------------------------------------------------

    static final class TimeSeriesSerializer extends StdSerializer<TimeSeries> {

        private static final long serialVersionUID = 1L;

        TimeSeriesSerializer() {
            super(TimeSeries.class);
        }

        @Override
        public void serialize(TimeSeries series, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("name", series.getName());
            gen.writeArrayFieldStart("points");
            for (int i = 0; i < series.size(); i++) {
                gen.writeStartObject();
                gen.writeStringField("date", series.dateAt(i).toString());
                double value = series.valueAt(i);
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    gen.writeNullField("value");
                } else {
                    gen.writeNumberField("value", value);
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }
}
