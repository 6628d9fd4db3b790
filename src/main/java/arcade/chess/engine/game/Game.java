package arcade.chess.engine.game;

import arcade.chess.engine.common.Color;
import arcade.chess.engine.common.Piece;
import arcade.chess.engine.common.PieceType;
import arcade.chess.engine.common.Square;
import arcade.chess.engine.game.board.Board;
import arcade.chess.engine.movegen.Move;
import arcade.chess.engine.movegen.MoveGenerator;
import arcade.chess.engine.movegen.utils.CheckUtils;
import arcade.chess.engine.utils.notations.FENUtils;
import arcade.chess.engine.utils.notations.MoveIOUtils;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The authoritative state of one game: the {@link Board}, move clocks, history, captured pieces and the
 * terminal flags, which are derived and recomputed after every move and after loading a position.
 * <p>
 * Only {@link #makeMove} (and the helpers built on it) mutates a game. Moves must come from the
 * legal move generator, they are not validated again when played.
 */
public class Game {
    private Board board;
    private final Board startingBoard;
    private final int startingHalfMoveClock;
    private final int startingFullMoveNumber;

    private int halfMoveClock;
    private int fullMoveNumber;

    private Move lastMove;
    private final List<HistoryEntry> moveHistory = new ObjectArrayList<>();
    // Pieces taken by white, and pieces taken by black
    private final List<Piece> capturedWhite = new ObjectArrayList<>();
    private final List<Piece> capturedBlack = new ObjectArrayList<>();

    private boolean isCheck;
    private boolean isCheckmate;
    private boolean isStalemate;
    private boolean isDraw;
    private DrawReason drawReason;
    private Color winner;

    private Opponent opponent = Opponent.AI;
    private Color playerColor = Color.WHITE;

    private final List<GameListener> listeners = new ObjectArrayList<>();

    private Square selectedSquare;
    private List<Move> validMoves = List.of();

    public Game(Board board, int halfMoveClock, int fullMoveNumber) {
        this.board = board;
        this.halfMoveClock = halfMoveClock;
        this.fullMoveNumber = fullMoveNumber;
        this.startingBoard = board.copy();
        this.startingHalfMoveClock = halfMoveClock;
        this.startingFullMoveNumber = fullMoveNumber;
        recomputeState();
    }

    public void addListener(GameListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GameListener listener) {
        listeners.remove(listener);
    }

    public void makeMove(Move move) {
        makeMove(move, move.promotion());
    }

    /**
     * Plays a legal move. For a promotion, {@code promotionChoice} replaces the piece carried by the move.
     *
     * @throws IllegalStateException    if the game is already over
     * @throws IllegalArgumentException if there is no piece to move or the promotion choice is not a promotion piece
     */
    public void makeMove(Move move, PieceType promotionChoice) {
        if(isGameOver()) {
            throw new IllegalStateException("Game is over, no more moves can be played");
        }
        applyMove(move, promotionChoice, true);
    }

    private void applyMove(Move move, PieceType promotionChoice, boolean notify) {
        Piece piece = board.getPiece(move.from());
        if(piece == null) {
            throw new IllegalArgumentException("No piece to move on " + move.from());
        }
        Color color = piece.color();

        Move movePlayed = move;
        if(move.isPromotion()) {
            if(!Arrays.asList(PieceType.PROMOTIONS).contains(promotionChoice)) {
                throw new IllegalArgumentException("A pawn cannot promote to " + promotionChoice);
            }
            movePlayed = move.withPromotion(promotionChoice);
        }

        Piece captured = move.enPassant()
                ? board.getPiece(move.from().row, move.to().col)
                : board.getPiece(move.to());

        if(captured != null) {
            (color == Color.WHITE ? capturedWhite : capturedBlack).add(captured);
            if(notify) {
                listeners.forEach(listener -> listener.onCapture(captured));
            }
        }

        board.playMove(movePlayed);

        if(piece.type() == PieceType.PAWN || captured != null) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }
        if(color == Color.BLACK) {
            fullMoveNumber++;
        }

        lastMove = movePlayed;
        String notation = MoveIOUtils.writeAlgebraicNotation(movePlayed, piece, captured, movePlayed.promotion());
        moveHistory.add(new HistoryEntry(notation, color, movePlayed.from(), movePlayed.to(), movePlayed, movePlayed.promotion()));

        clearSelection();
        recomputeState();

        if(notify) {
            fireMoveEvents(movePlayed);
        }
    }

    private void fireMoveEvents(Move move) {
        Color sideToMove = board.sideToMove();
        for(GameListener listener : listeners) {
            if(move.isPromotion()) {
                listener.onPromotion(move, move.promotion());
            }
            if(isCheckmate) {
                listener.onCheckmate(winner);
            } else if(isStalemate) {
                listener.onStalemate();
            } else if(isCheck) {
                listener.onCheck(sideToMove);
            }
            if(isDraw) {
                listener.onDraw(drawReason);
            }
            listener.onMove(move);
            listener.onTurnChange(sideToMove);
        }
    }

    // The fifty-move draw is flagged on its own, even next to a checkmate
    private void recomputeState() {
        Color sideToMove = board.sideToMove();
        isCheck = CheckUtils.isInCheck(board, sideToMove);
        isCheckmate = false;
        isStalemate = false;
        winner = null;

        if(!MoveGenerator.hasLegalMoves(board, sideToMove)) {
            if(isCheck) {
                isCheckmate = true;
                winner = sideToMove.getOppositeColor();
            } else {
                isStalemate = true;
            }
        }

        isDraw = halfMoveClock >= 100;
        drawReason = isDraw ? DrawReason.FIFTY_MOVE : null;
    }

    /**
     * UI helper. Selecting a piece of the side to move reports its legal moves, selecting one of their
     * destinations plays the move (or asks for a promotion piece), anything else clears the selection.
     */
    public SelectionResult selectSquare(Square square) {
        if(isGameOver()) {
            clearSelection();
            return SelectionResult.deselected();
        }

        Piece piece = board.getPiece(square);
        if(piece != null && piece.color() == board.sideToMove()) {
            selectedSquare = square;
            validMoves = MoveGenerator.generateLegalMoves(board, square);
            return SelectionResult.selected(validMoves);
        }

        if(selectedSquare != null) {
            for(Move move : validMoves) {
                if(move.to() == square) {
                    if(move.isPromotion()) {
                        return SelectionResult.promotionRequired(move);
                    }
                    makeMove(move);
                    return SelectionResult.moved(move);
                }
            }
        }

        clearSelection();
        return SelectionResult.deselected();
    }

    private void clearSelection() {
        selectedSquare = null;
        validMoves = List.of();
    }

    public boolean canUndo() {
        return !moveHistory.isEmpty();
    }

    /**
     * Takes back the last move by restarting from the starting position and replaying the rest of the history.
     * No listener is notified.
     *
     * @return false when there is nothing to undo
     */
    public boolean undoLastMove() {
        if(!canUndo()) {
            return false;
        }

        List<HistoryEntry> replay = new ObjectArrayList<>(moveHistory.subList(0, moveHistory.size() - 1));
        board = startingBoard.copy();
        halfMoveClock = startingHalfMoveClock;
        fullMoveNumber = startingFullMoveNumber;
        lastMove = null;
        moveHistory.clear();
        capturedWhite.clear();
        capturedBlack.clear();
        clearSelection();
        recomputeState();

        for(HistoryEntry entry : replay) {
            applyMove(entry.move(), entry.promotion(), false);
        }
        return true;
    }

    /**
     * Plays moves written in coordinate notation, e.g. {@code "e2e4 e7e5 e7e8q"}. A promotion without a
     * piece letter promotes to a queen.
     *
     * @throws IllegalArgumentException if a move is not legal in the position it is played from
     */
    public List<Move> playMoves(String moves) {
        List<Move> played = new ObjectArrayList<>();
        for(String coordinates : moves.trim().split("\\s+")) {
            if(coordinates.isEmpty()) {
                continue;
            }
            Move move = findLegalMove(coordinates);
            makeMove(move);
            played.add(move);
        }
        return played;
    }

    private Move findLegalMove(String coordinates) {
        if(coordinates.length() != 4 && coordinates.length() != 5) {
            throw new IllegalArgumentException("Move should be format 'e2e4' or 'e7e8q', got '" + coordinates + "'");
        }
        Square from = MoveIOUtils.getSquareFromName(coordinates.substring(0, 2));
        Square to = MoveIOUtils.getSquareFromName(coordinates.substring(2, 4));
        PieceType promotion = coordinates.length() == 5
                ? MoveIOUtils.getPromotionFromLetter(coordinates.charAt(4))
                : PieceType.QUEEN;

        for(Move move : MoveGenerator.generateLegalMoves(board, from)) {
            if(move.to() == to && (!move.isPromotion() || move.promotion() == promotion)) {
                return move;
            }
        }
        throw new IllegalArgumentException("Illegal move " + coordinates + " in " + exportFEN());
    }

    /**
     * @return the legal moves of the piece on the square, empty for an empty square or a piece of the side not to move
     */
    public List<Move> getLegalMoves(Square square) {
        Piece piece = board.getPiece(square);
        if(piece == null || piece.color() != board.sideToMove()) {
            return List.of();
        }
        return MoveGenerator.generateLegalMoves(board, square);
    }

    public List<Move> getAllLegalMoves(Color color) {
        return MoveGenerator.generateAllLegalMoves(board, color);
    }

    public boolean isInCheck(Color color) {
        return CheckUtils.isInCheck(board, color);
    }

    public boolean isSquareAttacked(Square square, Color byColor) {
        return CheckUtils.isSquareAttacked(board, square, byColor);
    }

    public Square findKing(Color color) {
        return board.findKing(color);
    }

    // No queen left, or at most two minor pieces on the whole board
    public boolean isEndgame() {
        int queens = 0;
        int minorPieces = 0;
        for(Color color : Color.values()) {
            queens += board.countPieces(PieceType.QUEEN, color);
            minorPieces += board.countPieces(PieceType.KNIGHT, color) + board.countPieces(PieceType.BISHOP, color);
        }
        return queens == 0 || minorPieces <= 2;
    }

    public PlayerState getPlayerState() {
        if(isCheckmate) {
            return PlayerState.CHECKMATE;
        }
        if(isStalemate) {
            return PlayerState.PAT;
        }
        if(isDraw) {
            return PlayerState.DRAW;
        }
        return PlayerState.IN_PROGRESS;
    }

    public boolean isAITurn() {
        return !isGameOver() && opponent == Opponent.AI && board.sideToMove() != playerColor;
    }

    public String exportFEN() {
        return FENUtils.getFENFromGame(this);
    }

    public Board board() {
        return board;
    }

    public Color sideToMove() {
        return board.sideToMove();
    }

    public int halfMoveClock() {
        return halfMoveClock;
    }

    public int fullMoveNumber() {
        return fullMoveNumber;
    }

    public Move lastMove() {
        return lastMove;
    }

    public List<HistoryEntry> moveHistory() {
        return Collections.unmodifiableList(moveHistory);
    }

    public List<Piece> capturedWhite() {
        return Collections.unmodifiableList(capturedWhite);
    }

    public List<Piece> capturedBlack() {
        return Collections.unmodifiableList(capturedBlack);
    }

    public boolean isCheck() {
        return isCheck;
    }

    public boolean isCheckmate() {
        return isCheckmate;
    }

    public boolean isStalemate() {
        return isStalemate;
    }

    public boolean isDraw() {
        return isDraw;
    }

    public DrawReason drawReason() {
        return drawReason;
    }

    public boolean isGameOver() {
        return isCheckmate || isStalemate || isDraw;
    }

    /**
     * @return the side which delivered checkmate, null otherwise
     */
    public Color winner() {
        return winner;
    }

    public Opponent opponent() {
        return opponent;
    }

    public void setOpponent(Opponent opponent) {
        this.opponent = opponent;
    }

    public Color playerColor() {
        return playerColor;
    }

    public void setPlayerColor(Color playerColor) {
        this.playerColor = playerColor;
    }

    public Square selectedSquare() {
        return selectedSquare;
    }

    public List<Move> validMoves() {
        return validMoves;
    }

    @Override
    public String toString() {
        return board.toAscii() + "\n\n" + exportFEN();
    }
}
