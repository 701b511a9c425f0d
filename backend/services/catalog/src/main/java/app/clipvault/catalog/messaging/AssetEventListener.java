package app.clipvault.catalog.messaging;

import app.clipvault.catalog.config.CatalogEventsProps;
import app.clipvault.catalog.event.AssetFinalizedEvent;
import app.clipvault.catalog.event.AssetRegisteredEvent;
import app.clipvault.catalog.reconcile.CatalogStoreException;
import app.clipvault.catalog.reconcile.InvalidEventException;
import app.clipvault.catalog.reconcile.LifecycleReconciler;
import app.clipvault.catalog.reconcile.ReconcileOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Feeds both lifecycle streams into the {@link LifecycleReconciler}.
 * <p>
 * Every record is acknowledged except a store failure while requeueing is enabled, which is
 * nacked so the same record is redelivered after {@code requeue-delay}. Malformed records are
 * logged and acknowledged: redelivering them cannot succeed.
 * <p>
 * Topics, group id and startup come from {@link CatalogEventsProps} through the
 * {@code __listener} bean reference.
 */
@Component
public class AssetEventListener {

    private static final Logger log = LoggerFactory.getLogger(AssetEventListener.class);

    private final LifecycleReconciler reconciler;
    private final ObjectMapper objectMapper;
    private final CatalogEventsProps props;

    public AssetEventListener(LifecycleReconciler reconciler, ObjectMapper objectMapper, CatalogEventsProps props) {
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @KafkaListener(
            id = "asset-registered",
            topics = "#{__listener.registeredTopic()}",
            groupId = "#{__listener.groupId()}",
            containerFactory = KafkaConsumerConfig.LISTENER_FACTORY,
            autoStartup = "#{__listener.autoStartup()}"
    )
    public void onRegistered(ConsumerRecord<String, String> record, Acknowledgment ack) {
        handle(record, ack, () -> reconciler.handleRegistered(read(record, AssetRegisteredEvent.class)));
    }

    @KafkaListener(
            id = "asset-finalized",
            topics = "#{__listener.finalizedTopic()}",
            groupId = "#{__listener.groupId()}",
            containerFactory = KafkaConsumerConfig.LISTENER_FACTORY,
            autoStartup = "#{__listener.autoStartup()}"
    )
    public void onFinalized(ConsumerRecord<String, String> record, Acknowledgment ack) {
        handle(record, ack, () -> reconciler.handleFinalized(read(record, AssetFinalizedEvent.class)));
    }

    public String registeredTopic() {
        return props.registeredTopic();
    }

    public String finalizedTopic() {
        return props.finalizedTopic();
    }

    public String groupId() {
        return props.groupId();
    }

    public boolean autoStartup() {
        return props.enabled();
    }

    private void handle(ConsumerRecord<String, String> record, Acknowledgment ack, Supplier<ReconcileOutcome> merge) {
        try {
            ReconcileOutcome outcome = merge.get();
            ack.acknowledge();
            log.debug("Lifecycle event merged topic={} partition={} offset={} outcome={}",
                    record.topic(), record.partition(), record.offset(), outcome);
        } catch (InvalidEventException ex) {
            ack.acknowledge();
            log.warn("Dropping malformed lifecycle event topic={} partition={} offset={} error={}",
                    record.topic(), record.partition(), record.offset(), ex.getMessage());
        } catch (CatalogStoreException ex) {
            if (props.requeueOnStoreFailure()) {
                log.warn("Catalog store failure, requeueing topic={} partition={} offset={} delay={}",
                        record.topic(), record.partition(), record.offset(), props.requeueDelay(), ex);
                ack.nack(props.requeueDelay());
            } else {
                ack.acknowledge();
                log.error("Catalog store failure, dropping lifecycle event topic={} partition={} offset={}",
                        record.topic(), record.partition(), record.offset(), ex);
            }
        } catch (RuntimeException ex) {
            ack.acknowledge();
            log.error("Lifecycle event merge failed, dropping topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset(), ex);
        }
    }

    private <T> T read(ConsumerRecord<String, String> record, Class<T> type) {
        String payload = record.value();
        if (payload == null || payload.isBlank()) {
            throw new InvalidEventException("Empty payload");
        }
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException ex) {
            throw new InvalidEventException("Unreadable " + type.getSimpleName() + " payload: " + ex.getOriginalMessage(), ex);
        }
    }
}
