package com.open_banking_archiver.service;

import com.open_banking_archiver.config.ArchiverProperties;
import com.open_banking_archiver.model.Bank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Emails the requisition link when a bank needs the user to log in again. Sends are not retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkEmailService {

    static final String SUBJECT = "Open Banking Connection Activation";

    private final JavaMailSender mailSender;
    private final ArchiverProperties props;

    /**
     * @return true once the message was handed to the SMTP server, false if sending failed
     */
    public Mono<Boolean> sendLink(String toEmail, Bank bank, String link) {
        return Mono.fromCallable(() -> {
                    SimpleMailMessage message = new SimpleMailMessage();
                    message.setFrom(props.getFromEmail());
                    message.setTo(toEmail);
                    message.setSubject(SUBJECT);
                    message.setText(buildBody(bank, link));
                    log.debug("Sending email: {}", message);
                    mailSender.send(message);
                    log.info("Sent link reminder for {} to {}", bank.getName(), toEmail);
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(MailException.class, e -> {
                    log.error("Failed to send link reminder for {} to {}: {}", bank.getName(), toEmail,
                            e.getMessage(), e);
                    return Mono.just(false);
                });
    }

    static String buildBody(Bank bank, String link) {
        return String.format(
                "Hello,%n%n" +
                "The open banking connection with %s is no longer active, so its transactions are not being " +
                "archived.%n%n" +
                "Log in to your bank through the link below to reactivate it:%n%n" +
                "%s%n",
                bank.getName(), link);
    }
}
