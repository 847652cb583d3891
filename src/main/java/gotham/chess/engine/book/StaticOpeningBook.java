package gotham.chess.engine.book;

import gotham.chess.engine.game.Game;
import gotham.chess.engine.game.board.utils.BoardGenerator;
import gotham.chess.engine.utils.notations.FENUtils;
import gotham.chess.engine.utils.notations.MoveIOUtils;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Opening table made of plain lines of UCI moves played from the standard start position, one opening per line.
 * Everything after a {@code #} is a comment. A move reached by several lines gets a higher weight.
 */
public final class StaticOpeningBook implements OpeningBook {
    public static final String DEFAULT_RESOURCE = "book/openings.txt";

    private final Object2ObjectOpenHashMap<String, List<Entry>> entries = new Object2ObjectOpenHashMap<>();
    private int lineCount;

    public static StaticOpeningBook fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static StaticOpeningBook fromClasspath(String resource) {
        InputStream in = StaticOpeningBook.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new UncheckedIOException(new IOException("Opening book resource not found: " + resource));
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromReader(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read opening book " + resource, e);
        }
    }

    public static StaticOpeningBook fromLines(List<String> lines) {
        StaticOpeningBook book = new StaticOpeningBook();
        int lineNumber = 0;
        for (String line : lines) {
            book.addLine(line, ++lineNumber);
        }
        return book;
    }

    static StaticOpeningBook fromReader(Reader reader) throws IOException {
        StaticOpeningBook book = new StaticOpeningBook();
        BufferedReader buffered = new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = buffered.readLine()) != null) {
            book.addLine(line, ++lineNumber);
        }
        return book;
    }

    private void addLine(String rawLine, int lineNumber) {
        int comment = rawLine.indexOf('#');
        String line = (comment >= 0 ? rawLine.substring(0, comment) : rawLine).trim();
        if (line.isEmpty()) return;

        Game game = BoardGenerator.newStandardGameBoard();
        for (String token : line.split("\\s+")) {
            int move;
            try {
                move = MoveIOUtils.readMove(game, token);
            } catch (IllegalArgumentException e) {
                System.err.println("Opening book line " + lineNumber + " stopped at '" + token + "': " + e.getMessage());
                break;
            }
            record(FENUtils.positionKey(game), move);
            game.playMove(move);
        }
        lineCount++;
    }

    private void record(String key, int move) {
        List<Entry> list = entries.computeIfAbsent(key, k -> new ArrayList<>(2));
        for (Entry e : list) {
            if (e.mv == move) { e.w++; return; }
        }
        list.add(new Entry(move, 1));
    }

    @Override
    public Optional<Integer> pickMove(Game game, BookPolicy policy, long rngSeed) {
        if (game.pliesPlayed() >= policy.maxPlies()) return Optional.empty();
        List<Entry> candidates = entries.get(FENUtils.positionKey(game));
        if (candidates == null) return Optional.empty();

        int[] legal = game.getLegalMoves();
        List<Entry> choices = new ArrayList<>(candidates.size());
        for (Entry e : candidates) {
            if (e.w >= policy.minWeight() && contains(legal, e.mv)) choices.add(e);
        }
        if (choices.isEmpty()) return Optional.empty();

        Random random = new Random(rngSeed);
        if (policy.randomnessPct() > 0 && random.nextInt(100) < policy.randomnessPct()) {
            int sum = 0;
            for (Entry e : choices) sum += e.w;
            int r = random.nextInt(sum);
            for (Entry e : choices) {
                r -= e.w;
                if (r < 0) return Optional.of(e.mv);
            }
        }
        if (!policy.preferMainline()) return Optional.of(choices.get(0).mv);
        // Stable: the first listed move wins among equals
        Entry best = choices.get(0);
        for (Entry e : choices) {
            if (e.w > best.w) best = e;
        }
        return Optional.of(best.mv);
    }

    /** Number of positions the book knows. */
    public int size() {
        return entries.size();
    }

    public int lineCount() {
        return lineCount;
    }

    @Override public boolean isLoaded() { return !entries.isEmpty(); }

    @Override public void close() { entries.clear(); }

    private static boolean contains(int[] moves, int move) {
        for (int m : moves) {
            if (m == move) return true;
        }
        return false;
    }

    private static final class Entry {
        private final int mv;
        private int w;

        private Entry(int mv, int w) {
            this.mv = mv;
            this.w = w;
        }

        @Override
        public String toString() {
            return "Entry[mv=" + MoveIOUtils.writeAlgebraicNotation(mv) + ", w=" + w + ']';
        }
    }
}
