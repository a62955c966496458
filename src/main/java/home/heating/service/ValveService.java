package home.heating.service;

import home.heating.enums.ValveStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Управление каналами CH и HW на системе с Y-plan трехходовым клапаном.
 * Пины этих каналов переключаются только через этот сервис.
 */
public interface ValveService {
    String CH = "CH";

    String HW = "HW";

    /**
     * Перевод канала в нужное состояние с учетом протокола клапана.
     * Выключение CH при выключенном HW делается через включение HW: клапан возвращается пружиной,
     * и пока он возвращается, остальные переключения откладываются.
     *
     * @param channel имя канала (пина)
     * @param on      требуемое состояние
     * @return завершается, когда состояние установлено, или с ActuatorException при ошибке реле
     * @throws home.heating.exception.RequestException если такого пина нет
     */
    CompletableFuture<Void> setState(String channel, boolean on);

    /**
     * Приведение клапана в известное положение при запуске: HW включается, после возврата
     * пружины оба канала выключаются
     *
     * @return завершается после выключения обоих каналов
     */
    CompletableFuture<Void> resetValve();

    ValveStatus getStatus();
}
