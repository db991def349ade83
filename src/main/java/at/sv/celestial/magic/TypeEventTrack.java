package at.sv.celestial.magic;

public enum TypeEventTrack {
    /**
     * The Sun between the blue hour and the golden hour altitude.
     */
    MAGIC_HOUR
}
