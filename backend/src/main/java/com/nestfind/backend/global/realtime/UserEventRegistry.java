package com.nestfind.backend.global.realtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import com.nestfind.backend.modules.auth.application.UserEventNotifier;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide map of live subscribers per user. One lock guards the map; listeners are invoked
 * outside it.
 */
@Component
public class UserEventRegistry implements UserEventNotifier {

    private static final Logger log = LoggerFactory.getLogger(UserEventRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private Map<UUID, List<Subscription>> subscriptions;
    private boolean open;

    @PostConstruct
    public void start() {
        lock.lock();
        try {
            subscriptions = new HashMap<>();
            open = true;
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        List<Subscription> drained = new ArrayList<>();
        lock.lock();
        try {
            open = false;
            if (subscriptions != null) {
                subscriptions.values().forEach(drained::addAll);
                subscriptions.clear();
            }
        } finally {
            lock.unlock();
        }
        drained.forEach(Subscription::close);
        log.info("User event registry closed {} subscription(s)", drained.size());
    }

    public Subscription subscribe(UUID userId, Consumer<String> listener, Runnable onClose) {
        Subscription subscription = new Subscription(this, userId, listener, onClose);
        lock.lock();
        try {
            if (!open) {
                throw new IllegalStateException("User event registry is not running");
            }
            subscriptions.computeIfAbsent(userId, id -> new ArrayList<>()).add(subscription);
        } finally {
            lock.unlock();
        }
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        lock.lock();
        try {
            if (subscriptions == null) {
                return;
            }
            List<Subscription> current = subscriptions.get(subscription.userId());
            if (current != null) {
                current.remove(subscription);
                if (current.isEmpty()) {
                    subscriptions.remove(subscription.userId());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int subscriberCount(UUID userId) {
        lock.lock();
        try {
            if (subscriptions == null) {
                return 0;
            }
            List<Subscription> current = subscriptions.get(userId);
            return current == null ? 0 : current.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void notify(UUID userId, String event) {
        List<Subscription> targets;
        lock.lock();
        try {
            if (!open) {
                return;
            }
            targets = new ArrayList<>(subscriptions.getOrDefault(userId, List.of()));
        } finally {
            lock.unlock();
        }
        for (Subscription target : targets) {
            try {
                target.listener().accept(event);
            } catch (RuntimeException ex) {
                log.warn("Dropping subscriber for user {} after delivery failure: {}", userId, ex.getMessage());
                unsubscribe(target);
                target.close();
            }
        }
    }

    public static final class Subscription {

        private final UserEventRegistry registry;
        private final UUID userId;
        private final Consumer<String> listener;
        private final Runnable onClose;

        private Subscription(UserEventRegistry registry, UUID userId, Consumer<String> listener, Runnable onClose) {
            this.registry = registry;
            this.userId = userId;
            this.listener = listener;
            this.onClose = onClose;
        }

        public UUID userId() {
            return userId;
        }

        Consumer<String> listener() {
            return listener;
        }

        public void cancel() {
            registry.unsubscribe(this);
        }

        private void close() {
            if (onClose != null) {
                onClose.run();
            }
        }
    }
}
