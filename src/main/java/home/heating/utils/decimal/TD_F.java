package home.heating.utils.decimal;

/* Temperature Decimal Formatter */
public class TD_F {
    public static String format(Float temperature) {
        return D_F.format(temperature) + " C°";
    }
}
