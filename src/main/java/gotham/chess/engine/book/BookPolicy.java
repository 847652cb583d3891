package gotham.chess.engine.book;

public record BookPolicy(
        int  maxPlies,        // stop using book after this many half-moves
        int  minWeight,       // ignore book entries reached by fewer lines than this
        int  randomnessPct,   // 0..100. 0 = deterministic; otherwise chance of a weighted draw
        boolean preferMainline // deterministic pick: most played move first, else first listed
) {
    public BookPolicy {
        if (maxPlies < 0) throw new IllegalArgumentException("maxPlies must be >= 0: " + maxPlies);
        if (randomnessPct < 0 || randomnessPct > 100) throw new IllegalArgumentException("randomnessPct must be in 0..100: " + randomnessPct);
    }

    public static BookPolicy defaults() { return new BookPolicy(20, 1, 0, true); }
}
