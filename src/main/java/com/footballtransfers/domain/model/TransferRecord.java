package com.footballtransfers.domain.model;

import java.util.Objects;

/**
 * One row of the published dataset: a transfer as reported by one club's page.
 *
 * Built once per (club page, row), coerced to typed values by the normalizer,
 * adjusted by the reconciler, then left untouched once written.
 */
public class TransferRecord {

    /** Year the league season begins. */
    private int season;

    /** League slug, e.g. "premier-league". */
    private String league;

    /** Club whose page reported the transfer. */
    private String club;

    private Window window;

    /** Direction relative to {@link #club}. */
    private Movement movement;

    private String playerName;

    /** Stable source identifier of the player; never varies with name spelling. */
    private String playerId;

    /** Age in years at the transfer date. Null when the page omits it. */
    private Integer age;

    private String nationality;

    /**
     * Canonical position. Both the full name and the abbreviation columns are
     * derived from it, so they can never disagree or appear alone.
     */
    private Position position;

    /** Market value in whole euros, null when not reported. */
    private Long marketValue;

    /** Counterpart club on the other side of the transfer. */
    private String dealingClub;

    private String dealingCountry;

    /**
     * Fee in whole euros. Null for free transfers, loans without a fee and
     * unreported fees; never zero for those cases.
     */
    private Long fee;

    private boolean loan;

    /** Transfer id assigned by the source site, when the page links one. Not serialized. */
    private String sourceTransferId;

    /** Row position on the reporting page, used to keep pairing deterministic. Not serialized. */
    private int sourceRowIndex;

    private ReconciliationStatus reconciliationStatus = ReconciliationStatus.PENDING;

    public int getSeason() {
        return season;
    }

    public void setSeason(int season) {
        this.season = season;
    }

    public String getLeague() {
        return league;
    }

    public void setLeague(String league) {
        this.league = league;
    }

    public String getClub() {
        return club;
    }

    public void setClub(String club) {
        this.club = club;
    }

    public Window getWindow() {
        return window;
    }

    public void setWindow(Window window) {
        this.window = window;
    }

    public Movement getMovement() {
        return movement;
    }

    public void setMovement(Movement movement) {
        this.movement = movement;
    }

    public String getPlayerName() {
        return playerName;
    }

    public void setPlayerName(String playerName) {
        this.playerName = playerName;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public String getNationality() {
        return nationality;
    }

    public void setNationality(String nationality) {
        this.nationality = nationality;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    /** Full position name, or null when the position is unknown. */
    public String getPositionName() {
        return position != null ? position.getFullName() : null;
    }

    /** Position abbreviation, or null when the position is unknown. */
    public String getPos() {
        return position != null ? position.getAbbreviation() : null;
    }

    public Long getMarketValue() {
        return marketValue;
    }

    public void setMarketValue(Long marketValue) {
        this.marketValue = marketValue;
    }

    public String getDealingClub() {
        return dealingClub;
    }

    public void setDealingClub(String dealingClub) {
        this.dealingClub = dealingClub;
    }

    public String getDealingCountry() {
        return dealingCountry;
    }

    public void setDealingCountry(String dealingCountry) {
        this.dealingCountry = dealingCountry;
    }

    public Long getFee() {
        return fee;
    }

    public void setFee(Long fee) {
        this.fee = fee;
    }

    public boolean isLoan() {
        return loan;
    }

    public void setLoan(boolean loan) {
        this.loan = loan;
    }

    public String getSourceTransferId() {
        return sourceTransferId;
    }

    public void setSourceTransferId(String sourceTransferId) {
        this.sourceTransferId = sourceTransferId;
    }

    public int getSourceRowIndex() {
        return sourceRowIndex;
    }

    public void setSourceRowIndex(int sourceRowIndex) {
        this.sourceRowIndex = sourceRowIndex;
    }

    public ReconciliationStatus getReconciliationStatus() {
        return reconciliationStatus;
    }

    public void setReconciliationStatus(ReconciliationStatus reconciliationStatus) {
        this.reconciliationStatus = reconciliationStatus;
    }

    /** Club that acquired the player. */
    public String getBuyingClub() {
        return movement == Movement.IN ? club : dealingClub;
    }

    /** Club that released the player. */
    public String getSellingClub() {
        return movement == Movement.OUT ? club : dealingClub;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransferRecord that)) return false;
        return season == that.season
            && loan == that.loan
            && Objects.equals(league, that.league)
            && Objects.equals(club, that.club)
            && window == that.window
            && movement == that.movement
            && Objects.equals(playerName, that.playerName)
            && Objects.equals(playerId, that.playerId)
            && Objects.equals(age, that.age)
            && Objects.equals(nationality, that.nationality)
            && position == that.position
            && Objects.equals(marketValue, that.marketValue)
            && Objects.equals(dealingClub, that.dealingClub)
            && Objects.equals(dealingCountry, that.dealingCountry)
            && Objects.equals(fee, that.fee);
    }

    @Override
    public int hashCode() {
        return Objects.hash(season, league, club, window, movement, playerName, playerId, age,
            nationality, position, marketValue, dealingClub, dealingCountry, fee, loan);
    }

    @Override
    public String toString() {
        return "TransferRecord{" + league + "/" + season + "/" + window + " " + club + " " + movement
            + " " + playerName + " (" + playerId + ") " + (movement == Movement.IN ? "from " : "to ")
            + dealingClub + ", fee=" + fee + ", loan=" + loan + "}";
    }
}
