package gotham.chess.engine.book;

import gotham.chess.engine.game.Game;

import java.util.Optional;

public final class NoOpeningBook implements OpeningBook {
    public static final NoOpeningBook INSTANCE = new NoOpeningBook();

    private NoOpeningBook() {}

    @Override
    public Optional<Integer> pickMove(Game game, BookPolicy policy, long rngSeed) {
        return Optional.empty();
    }

    @Override public boolean isLoaded() { return false; }

    @Override public void close() {}
}
