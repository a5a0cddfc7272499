package com.lunarview.streaming;

/**
 * Size-driven quality ladder.
 *
 * Evaluated once per sampling tick: a frame larger than the downgrade
 * threshold moves one step down, a frame smaller than the upgrade threshold
 * moves one step up, anything in between holds. The gap between the two
 * thresholds is the hysteresis band.
 */
public class QualityController {

    private final int downgradeBytes;
    private final int upgradeBytes;

    public QualityController(int downgradeBytes, int upgradeBytes) {
        if (upgradeBytes >= downgradeBytes) {
            throw new IllegalArgumentException("upgrade threshold must be below downgrade threshold");
        }
        this.downgradeBytes = downgradeBytes;
        this.upgradeBytes = upgradeBytes;
    }

    /**
     * @param gameMode when true only the GAME/GAMELOW ladder is used
     */
    public QualityPreset evaluate(QualityPreset current, int lastFrameBytes, boolean gameMode) {
        if (lastFrameBytes <= 0) {
            return current;
        }
        if (gameMode) {
            if (!current.isGame()) {
                return QualityPreset.GAME;
            }
        } else if (current.isGame()) {
            return current;
        }

        if (lastFrameBytes > downgradeBytes) {
            return current.lower();
        }
        if (lastFrameBytes < upgradeBytes) {
            return current.higher();
        }
        return current;
    }

    public int getDowngradeBytes() { return downgradeBytes; }
    public int getUpgradeBytes() { return upgradeBytes; }
}
