package utala.game.replay;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Reads and writes replays as JSON with snake_case field names.
 */
public final class ReplaySerializer {
    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private ReplaySerializer() {
    }

    public static String toJson(Replay replay) {
        return GSON.toJson(replay);
    }

    public static Replay fromJson(String json) throws ReplayException {
        Replay replay;
        try {
            replay = GSON.fromJson(json, Replay.class);
        } catch (JsonParseException e) {
            throw new ReplayException("Malformed replay: " + e.getMessage(), e);
        }
        if (replay == null) {
            throw new ReplayException("Empty replay");
        }
        if (!Replay.FORMAT_VERSION.equals(replay.getFormatVersion())) {
            throw new ReplayException("Unsupported replay format: " + replay.getFormatVersion());
        }
        if (replay.rawActions() == null) {
            throw new ReplayException("Replay has no action list");
        }
        for (int[] action : replay.rawActions()) {
            if (action == null || action.length != 2 || (action[0] != 0 && action[0] != 1)) {
                throw new ReplayException("Malformed action entry in replay");
            }
        }
        Integer winner = replay.rawWinner();
        if (winner != null && winner != 0 && winner != 1) {
            throw new ReplayException("Unknown winner in replay: " + winner);
        }
        return replay;
    }

    public static void write(Replay replay, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(toJson(replay));
            out.newLine();
        }
    }

    public static Replay read(Path file) throws IOException, ReplayException {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = in.readLine()) != null) {
                sb.append(line).append('\n');
            }
        }
        return fromJson(sb.toString());
    }
}
