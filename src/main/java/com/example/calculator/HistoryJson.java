package com.example.calculator;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON rendering of calculator history.
 *
 * Entries are written as objects with {@code result}, {@code operation},
 * {@code operands} and an ISO-8601 {@code timestamp}.
 */
public final class HistoryJson {

    private static final Type HISTORY_TYPE = new TypeToken<List<Entry>>() {}.getType();

    private static final Gson gson = new GsonBuilder()
        .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
        .serializeSpecialFloatingPointValues()
        .setPrettyPrinting()
        .create();

    private HistoryJson() {
    }

    public static String toJson(List<CalculationResult> history) {
        List<Entry> entries = new ArrayList<>(history.size());
        for (CalculationResult result : history) {
            entries.add(new Entry(result));
        }
        return gson.toJson(entries, HISTORY_TYPE);
    }

    /**
     * Parse history previously produced by {@link #toJson(List)}.
     *
     * @throws JsonParseException if the text is not a valid history array
     */
    public static List<CalculationResult> fromJson(String json) {
        List<Entry> entries = gson.fromJson(json, HISTORY_TYPE);
        if (entries == null) {
            throw new JsonParseException("Empty history document");
        }
        List<CalculationResult> history = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            if (entry == null || entry.result == null || entry.operation == null
                    || entry.operands == null || entry.timestamp == null) {
                throw new JsonParseException("Incomplete history entry at index " + i);
            }
            Operation op;
            try {
                op = Operation.fromName(entry.operation);
            } catch (CalculatorException e) {
                throw new JsonParseException("Unknown operation at index " + i + ": " + entry.operation, e);
            }
            if (entry.operands.length != op.getArity()) {
                throw new JsonParseException("Operation " + op.getName() + " at index " + i + " expects "
                    + op.getArity() + " operands, got " + entry.operands.length);
            }
            history.add(new CalculationResult(entry.result, op.getName(), entry.operands, entry.timestamp));
        }
        return history;
    }

    // Wire shape of one history entry.
    private static final class Entry {
        private Double result;
        private String operation;
        private double[] operands;
        private Instant timestamp;

        Entry() {
        }

        Entry(CalculationResult source) {
            this.result = source.getResult();
            this.operation = source.getOperation();
            this.operands = source.getOperands();
            this.timestamp = source.getTimestamp();
        }
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("Expected ISO-8601 timestamp at " + in.getPath());
            }
            String text = in.nextString();
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("Invalid timestamp: " + text, e);
            }
        }
    }
}
