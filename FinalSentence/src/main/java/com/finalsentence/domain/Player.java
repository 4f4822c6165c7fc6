package com.finalsentence.domain;

/**
 * A player's in-room state for the current round.
 *
 * <p>Round status only moves forward within a round: {@code PLAYING} to {@code COMPLETED} or
 * {@code ELIMINATED}. {@link #resetForRound()} is the only way back to {@code PLAYING}. The
 * {@code connected} flag is independent of the round status.
 *
 * <p>Not thread-safe; callers hold the owning {@link Room}'s lock.
 */
public class Player {
  public static final String DEFAULT_AVATAR = "default";

  private final String id;
  private final String displayName;
  private String avatar;

  private PlayerStatus status = PlayerStatus.CONNECTED;
  private int errors;
  private double wpm;
  private double progress;
  private boolean connected = true;
  private EliminationReason eliminationReason;
  private int completionOrder;

  public Player(String id, String displayName) {
    this(id, displayName, null);
  }

  public Player(String id, String displayName, String avatar) {
    this.id = id;
    this.displayName = displayName;
    this.avatar = avatar == null ? DEFAULT_AVATAR : avatar;
  }

  public String id() {
    return id;
  }

  public String displayName() {
    return displayName;
  }

  public String avatar() {
    return avatar;
  }

  public void avatar(String a) {
    avatar = a;
  }

  public PlayerStatus status() {
    return status;
  }

  public int errors() {
    return errors;
  }

  public double wpm() {
    return wpm;
  }

  public double progress() {
    return progress;
  }

  public boolean connected() {
    return connected;
  }

  public void connected(boolean c) {
    connected = c;
  }

  public EliminationReason eliminationReason() {
    return eliminationReason;
  }

  /** Position among this round's completions, 1-based; 0 if not completed. */
  public int completionOrder() {
    return completionOrder;
  }

  public boolean playing() {
    return status == PlayerStatus.PLAYING;
  }

  /** Put the player back into contention for a new round. */
  public void resetForRound() {
    status = PlayerStatus.PLAYING;
    errors = 0;
    wpm = 0;
    progress = 0;
    eliminationReason = null;
    completionOrder = 0;
  }

  /** Exact phrase submitted. */
  public void complete(double wordsPerMinute, int order) {
    requirePlaying();
    status = PlayerStatus.COMPLETED;
    progress = 100;
    wpm = wordsPerMinute;
    completionOrder = order;
  }

  /**
   * Count a wrong submission.
   *
   * @param penalty progress points lost, floored at zero
   * @param maxErrors error count at which the player is eliminated
   * @return true if this error eliminated the player
   */
  public boolean recordError(double penalty, int maxErrors) {
    requirePlaying();
    errors++;
    progress = Math.max(0, progress - penalty);
    if (errors >= maxErrors) {
      eliminate(EliminationReason.ERRORS);
      return true;
    }
    return false;
  }

  public void eliminate(EliminationReason reason) {
    requirePlaying();
    status = PlayerStatus.ELIMINATED;
    eliminationReason = reason;
  }

  public PlayerSnapshot snapshot() {
    return new PlayerSnapshot(
        id, displayName, avatar, status, errors, wpm, progress, connected, eliminationReason);
  }

  private void requirePlaying() {
    if (status != PlayerStatus.PLAYING) {
      throw new IllegalStateException("Player " + id + " is " + status + ", not PLAYING");
    }
  }
}
