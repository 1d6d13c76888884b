package json.stream.encoder.demo;

import json.stream.encoder.BufferedJsonSink;
import json.stream.encoder.JsonEncodeStatus;
import json.stream.encoder.JsonEncoder;
import json.stream.encoder.OutputStreamJsonSink;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Writes a small crash-report style document of breadcrumbs to standard output.
///
/// Run with `--pretty` for indented output.
public final class BreadcrumbReportDemo {

    /// A user or system event recorded before a crash.
    public record Breadcrumb(String timestamp, String name, String type, Map<String, Object> metadata) {
    }

    private BreadcrumbReportDemo() {
    }

    public static void main(String[] args) throws IOException {
        final boolean pretty = args.length > 0 && "--pretty".equals(args[0]);

        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("from", "MainActivity");
        metadata.put("to", "SettingsActivity");
        metadata.put("durationMs", 1532L);
        final var breadcrumbs = List.of(
                new Breadcrumb("2026-10-18T09:15:00.123Z", "App launched", "state", Map.of()),
                new Breadcrumb("2026-10-18T09:15:04.871Z", "Navigation", "navigation", metadata));

        final var out = new OutputStreamJsonSink(System.out);
        final var buffered = new BufferedJsonSink(out, 4096);
        final var encoder = new JsonEncoder();
        encoder.beginEncode(pretty, buffered);
        writeReport(encoder, "demo-app", 0.75, breadcrumbs).orThrow("report");
        encoder.endEncode().orThrow("endEncode");
        buffered.flush().orThrow("flush");
        out.flush();
        System.out.println();
    }

    /// Encodes the report object, leaving it open so more sections can follow.
    public static JsonEncodeStatus writeReport(JsonEncoder encoder, String app, double batteryLevel,
                                               List<Breadcrumb> breadcrumbs) {
        JsonEncodeStatus result;
        if ((result = encoder.beginObject(null)) != JsonEncodeStatus.OK
                || (result = encoder.addStringElement("app", app)) != JsonEncodeStatus.OK
                || (result = encoder.addFloatingPointElement("batteryLevel", batteryLevel)) != JsonEncodeStatus.OK
                || (result = encoder.beginArray("breadcrumbs")) != JsonEncodeStatus.OK) {
            return result;
        }
        for (final var breadcrumb : breadcrumbs) {
            if ((result = writeBreadcrumb(encoder, breadcrumb)) != JsonEncodeStatus.OK) {
                return result;
            }
        }
        return encoder.endContainer();
    }

    static JsonEncodeStatus writeBreadcrumb(JsonEncoder encoder, Breadcrumb breadcrumb) {
        JsonEncodeStatus result;
        if ((result = encoder.beginObject(null)) != JsonEncodeStatus.OK
                || (result = encoder.addStringElement("timestamp", breadcrumb.timestamp())) != JsonEncodeStatus.OK
                || (result = encoder.addStringElement("name", breadcrumb.name())) != JsonEncodeStatus.OK
                || (result = encoder.addStringElement("type", breadcrumb.type())) != JsonEncodeStatus.OK
                || (result = encoder.beginObject("metaData")) != JsonEncodeStatus.OK) {
            return result;
        }
        for (final var entry : breadcrumb.metadata().entrySet()) {
            if ((result = writeValue(encoder, entry.getKey(), entry.getValue())) != JsonEncodeStatus.OK) {
                return result;
            }
        }
        if ((result = encoder.endContainer()) != JsonEncodeStatus.OK) {
            return result;
        }
        return encoder.endContainer();
    }

    private static JsonEncodeStatus writeValue(JsonEncoder encoder, String name, Object value) {
        if (value instanceof String s) {
            return encoder.addStringElement(name, s);
        } else if (value instanceof Boolean b) {
            return encoder.addBooleanElement(name, b);
        } else if (value instanceof Double || value instanceof Float) {
            return encoder.addFloatingPointElement(name, ((Number) value).doubleValue());
        } else if (value instanceof Number n) {
            return encoder.addIntegerElement(name, n.longValue());
        } else if (value instanceof byte[] bytes) {
            return encoder.addDataElement(name, bytes);
        } else if (value == null) {
            return encoder.addNullElement(name);
        }
        return encoder.addStringElement(name, value.toString());
    }
}
