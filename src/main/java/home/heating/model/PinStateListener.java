package home.heating.model;

@FunctionalInterface
public interface PinStateListener {
    /**
     * Вызывается после успешной записи нового состояния пина
     *
     * @param pin пин
     * @param on  новое состояние
     */
    void onStateChanged(Pin pin, boolean on);
}
