package home.heating.service.impl;

import home.heating.configuration.TelegramBotConfiguration;
import home.heating.enums.BotCommands;
import home.heating.exception.RequestException;
import home.heating.service.BotService;
import home.heating.service.ControllerService;
import home.heating.service.HealthService;
import home.heating.service.HistoryService;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.Arrays;

@Service
public class BotServiceImpl extends TelegramLongPollingBot implements BotService {
    private static final String SOURCE_PREFIX = "telegram-";
    private final Logger logger = LoggerFactory.getLogger(BotServiceImpl.class);
    private final TelegramBotConfiguration telegramBotConfiguration;
    private final ControllerService controllerService;
    private final HistoryService historyService;
    private final HealthService healthService;
    private BotSession session;

    public BotServiceImpl(
        TelegramBotConfiguration telegramBotConfiguration,
        ControllerService controllerService,
        HistoryService historyService,
        @Lazy HealthService healthService
    ) {
        super(telegramBotConfiguration.getToken());
        this.telegramBotConfiguration = telegramBotConfiguration;
        this.controllerService = controllerService;
        this.historyService = historyService;
        this.healthService = healthService;
    }

    @EventListener({ContextRefreshedEvent.class})
    public void init() {
        if (!telegramBotConfiguration.getEnabled()) {
            logger.info("Бот отключен в настройках");
            return;
        }
        try {
            connect();
            notify("Система была перезагружена, на связи");
        } catch (TelegramApiException e) {
            logger.error("Ошибка подключения к telegram");
        }
    }

    @Scheduled(fixedRateString = "${bot.sessionCheckInterval}")
    public void checkSessionAndReconnect() {
        if (!telegramBotConfiguration.getEnabled()) {
            return;
        }
        logger.debug("Проверка связи");
        if (session == null || !session.isRunning()) {
            try {
                connect();
                notify("Связь восстановлена");
            } catch (TelegramApiException e) {
                logger.error("Ошибка подключения к telegram");
            }
        }
    }

    private void connect() throws TelegramApiException {
        TelegramBotsApi telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
        session = telegramBotsApi.registerBot(this);
    }

    @Override
    public String getBotUsername() {
        return telegramBotConfiguration.getBotName();
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage() || !userHasPrivileges(update.getMessage().getFrom())) {
            logger.warn("Получено сообщение от неизвестного пользователя, игнорируем");
            return;
        }

        logger.debug("Получено сообщение {} от пользователя {}",
            update.getMessage().getText(),
            update.getMessage().getFrom()
        );

        String response = processBotCommand(update.getMessage().getText(), update.getMessage().getFrom());

        if (response != null) {
            sendMessage(update.getMessage().getChatId(), response);
            logger.debug("Отправлен ответ {} в чат {}", response, update.getMessage().getChatId());
        }
    }

    private @Nullable String processBotCommand(@Nullable String messageText, User user) {
        if (messageText == null || messageText.isBlank()) {
            return null;
        }
        String[] tokens = messageText.trim().split("\\s+");
        String command = tokens[0];
        String source = SOURCE_PREFIX + user.getId();
        try {
            if (BotCommands.GET_STATUS.getTelegramCommand().equals(command)) {
                logger.info("Получена команда на получение статуса системы");
                return formatStatus();
            }
            if (BotCommands.REQUEST.getTelegramCommand().equals(command)) {
                if (tokens.length < 4) {
                    return "Формат: /request <CH|HW|ALL> <температура|OFF|BOOST n> <до когда|boost|now>";
                }
                String target = String.join(" ", Arrays.copyOfRange(tokens, 2, tokens.length - 1));
                logger.info("Получен запрос температуры {} {} до {} от {}", tokens[1], target,
                    tokens[tokens.length - 1], source);
                controllerService.addRequest(tokens[1], source, target, tokens[tokens.length - 1]);
                return "Запрос принят\n\n" + controllerService.getFormattedStatus();
            }
            if (BotCommands.PIN.getTelegramCommand().equals(command)) {
                if (tokens.length < 3) {
                    return "Формат: /pin <пин> <on|off|boost> <до когда|now>";
                }
                String until = tokens.length > 3 ? tokens[3] : null;
                logger.info("Получен запрос пина {} = {} до {} от {}", tokens[1], tokens[2], until, source);
                controllerService.addPinRequest(tokens[1], source, tokens[2], until);
                return "Запрос принят\n\n" + controllerService.getFormattedStatus();
            }
        } catch (RequestException e) {
            logger.warn("Некорректный запрос {}: {}", messageText, e.getMessage());
            return "Ошибка: " + e.getMessage();
        }
        return null;
    }

    private String formatStatus() {
        return "Общий статус системы - " + healthService.getFormattedStatus() + "\n\n"
            + controllerService.getFormattedStatus() + "\n"
            + historyService.getFormattedStatusForLastDay();
    }

    private void sendMessage(Long chatId, String text) {
        SendMessage sendMessage = new SendMessage();
        sendMessage.setChatId(String.valueOf(chatId));
        sendMessage.setText(text);
        try {
            execute(sendMessage);
        } catch (TelegramApiException e) {
            logger.error("Не удалось отправить сообщение в чат {}", chatId, e);
        }
    }

    @Override
    public void notify(String text) {
        if (!telegramBotConfiguration.getEnabled()) {
            logger.info("Уведомление (бот отключен): {}", text);
            return;
        }
        for (Long chatId : telegramBotConfiguration.getChatIds()) {
            sendMessage(chatId, text);
        }
    }

    private boolean userHasPrivileges(User user) {
        return telegramBotConfiguration.getValidUserIds().contains(user.getId());
    }
}
