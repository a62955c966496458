package home.heating;

import home.heating.configuration.TelegramBotConfiguration;
import home.heating.exception.RequestException;
import home.heating.service.ControllerService;
import home.heating.service.HealthService;
import home.heating.service.HistoryService;
import home.heating.service.impl.BotServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.telegram.telegrambots.meta.api.objects.User;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BotServiceTest {
    private ControllerService controllerService;

    private BotServiceImpl botService;

    private User user;

    @BeforeEach
    void setUp() {
        TelegramBotConfiguration configuration = Mockito.mock(TelegramBotConfiguration.class);
        Mockito.when(configuration.getToken()).thenReturn("no_data");
        Mockito.when(configuration.getEnabled()).thenReturn(false);
        controllerService = Mockito.mock(ControllerService.class);
        Mockito.when(controllerService.getFormattedStatus()).thenReturn("статус");
        HealthService healthService = Mockito.mock(HealthService.class);
        Mockito.when(healthService.getFormattedStatus()).thenReturn("все хорошо");
        HistoryService historyService = Mockito.mock(HistoryService.class);
        Mockito.when(historyService.getFormattedStatusForLastDay()).thenReturn("история");
        botService = new BotServiceImpl(configuration, controllerService, historyService, healthService);
        user = Mockito.mock(User.class);
        Mockito.when(user.getId()).thenReturn(42L);
    }

    private String invokeProcessBotCommand(String text) {
        try {
            Method method = botService.getClass().getDeclaredMethod("processBotCommand", String.class, User.class);
            method.setAccessible(true);
            return (String) method.invoke(botService, text, user);
        } catch (Exception e) {
            throw new RuntimeException("Не удалось вызвать метод обработки команды бота", e);
        }
    }

    @Test
    @DisplayName("Команда запроса температуры с boost-целью из двух слов")
    void checkRequestCommand() {
        String response = invokeProcessBotCommand("/request CH BOOST 45 boost");
        Mockito.verify(controllerService).addRequest("CH", "telegram-42", "BOOST 45", "boost");
        assertTrue(response.startsWith("Запрос принят"));
    }

    @Test
    @DisplayName("Команда запроса пина")
    void checkPinCommand() {
        invokeProcessBotCommand("/pin HW boost");
        Mockito.verify(controllerService).addPinRequest("HW", "telegram-42", "boost", null);

        invokeProcessBotCommand("/pin HW off now");
        Mockito.verify(controllerService).addPinRequest("HW", "telegram-42", "off", "now");
    }

    @Test
    @DisplayName("Ошибка разбора запроса возвращается пользователю")
    void checkBadRequest() {
        Mockito.doThrow(new RequestException("Неизвестный термостат 'POOL'"))
            .when(controllerService).addRequest("POOL", "telegram-42", "20", "now");
        assertEquals("Ошибка: Неизвестный термостат 'POOL'", invokeProcessBotCommand("/request POOL 20 now"));
        assertTrue(invokeProcessBotCommand("/request CH").startsWith("Формат"));
        assertNull(invokeProcessBotCommand("привет"));
    }

    @Test
    @DisplayName("Команда статуса собирает сведения всех сервисов")
    void checkStatusCommand() {
        String response = invokeProcessBotCommand("/get_status");
        assertTrue(response.contains("все хорошо"));
        assertTrue(response.contains("статус"));
        assertTrue(response.contains("история"));
    }
}
