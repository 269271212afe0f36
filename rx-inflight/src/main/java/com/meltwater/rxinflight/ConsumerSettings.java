package com.meltwater.rxinflight;

/**
 * This class contains the consumer settings used by the {@link RabbitInFlightConsumer}
 */
public class ConsumerSettings {

    public static final int DEFAULT_PREFETCH_COUNT = 0; //unlimited
    public static final boolean DEFAULT_REQUEUE_ON_NACK = true;
    public static final long DEFAULT_DRAIN_POLL_INTERVAL_MILLIS = 1_000;
    public static final int DEFAULT_DRAIN_MAX_POLLS = 300;
    public static final int DEFAULT_DRAIN_PROGRESS_LOG_POLLS = 5;
    public static final long DEFAULT_UNACKED_WARNING_MILLIS = 6 * 60 * 1000;

    private int pre_fetch_count                 = DEFAULT_PREFETCH_COUNT;
    private String consumer_tag_prefix          = "inflight";
    private String consumer_name                = "";
    private String workflow_id                  = "";
    private boolean requeue_on_nack             = DEFAULT_REQUEUE_ON_NACK;
    private long drain_poll_interval_millis     = DEFAULT_DRAIN_POLL_INTERVAL_MILLIS;
    private int drain_max_polls                 = DEFAULT_DRAIN_MAX_POLLS;
    private int drain_progress_log_polls        = DEFAULT_DRAIN_PROGRESS_LOG_POLLS;
    private long unacked_warning_millis         = DEFAULT_UNACKED_WARNING_MILLIS;

    public int getPre_fetch_count() {
        return pre_fetch_count;
    }

    public String getConsumer_tag_prefix() {
        return consumer_tag_prefix;
    }

    public String getConsumer_name() {
        return consumer_name;
    }

    public String getWorkflow_id() {
        return workflow_id;
    }

    public boolean isRequeue_on_nack() {
        return requeue_on_nack;
    }

    public long getDrain_poll_interval_millis() {
        return drain_poll_interval_millis;
    }

    public int getDrain_max_polls() {
        return drain_max_polls;
    }

    public int getDrain_progress_log_polls() {
        return drain_progress_log_polls;
    }

    public long getUnacked_warning_millis() {
        return unacked_warning_millis;
    }

    /**
     * @param pre_fetch_count how many un-acked messages rabbit may deliver to one consumer, 0 means unlimited
     */
    public ConsumerSettings withPreFetchCount(int pre_fetch_count) {
        assert pre_fetch_count>=0;
        this.pre_fetch_count = pre_fetch_count;
        return this;
    }

    public ConsumerSettings withConsumerTagPrefix(String consumer_tag_prefix) {
        assert consumer_tag_prefix!=null;
        this.consumer_tag_prefix = consumer_tag_prefix;
        return this;
    }

    /**
     * @param consumer_name the name of the consumer, included when dispatch errors are logged
     */
    public ConsumerSettings withConsumerName(String consumer_name) {
        assert consumer_name!=null;
        this.consumer_name = consumer_name;
        return this;
    }

    /**
     * @param workflow_id the id of the workflow the messages are dispatched to, included when dispatch errors are logged
     */
    public ConsumerSettings withWorkflowId(String workflow_id) {
        assert workflow_id!=null;
        this.workflow_id = workflow_id;
        return this;
    }

    public ConsumerSettings withRequeueOnNack(boolean requeue_on_nack) {
        this.requeue_on_nack = requeue_on_nack;
        return this;
    }

    public ConsumerSettings withDrainPollIntervalMillis(long drain_poll_interval_millis) {
        assert drain_poll_interval_millis>0;
        this.drain_poll_interval_millis = drain_poll_interval_millis;
        return this;
    }

    /**
     * @param drain_max_polls the max number of times to poll for outstanding deliveries before the channel is closed anyway
     */
    public ConsumerSettings withDrainMaxPolls(int drain_max_polls) {
        assert drain_max_polls>=0;
        this.drain_max_polls = drain_max_polls;
        return this;
    }

    public ConsumerSettings withDrainProgressLogPolls(int drain_progress_log_polls) {
        assert drain_progress_log_polls>0;
        this.drain_progress_log_polls = drain_progress_log_polls;
        return this;
    }

    public ConsumerSettings withUnackedWarningMillis(long unacked_warning_millis) {
        assert unacked_warning_millis>0;
        this.unacked_warning_millis = unacked_warning_millis;
        return this;
    }

    @Override
    public String toString() {
        return "{" +
                "pre_fetch_count:" + pre_fetch_count +
                ", consumer_tag_prefix:'" + consumer_tag_prefix + "'" +
                ", consumer_name:'" + consumer_name + "'" +
                ", workflow_id:'" + workflow_id + "'" +
                ", requeue_on_nack:" + requeue_on_nack +
                ", drain_poll_interval_millis:" + drain_poll_interval_millis +
                ", drain_max_polls:" + drain_max_polls +
                ", drain_progress_log_polls:" + drain_progress_log_polls +
                ", unacked_warning_millis:" + unacked_warning_millis +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsumerSettings that = (ConsumerSettings) o;
        if (pre_fetch_count != that.pre_fetch_count) return false;
        if (requeue_on_nack != that.requeue_on_nack) return false;
        if (drain_poll_interval_millis != that.drain_poll_interval_millis) return false;
        if (drain_max_polls != that.drain_max_polls) return false;
        if (drain_progress_log_polls != that.drain_progress_log_polls) return false;
        if (unacked_warning_millis != that.unacked_warning_millis) return false;
        if (!consumer_tag_prefix.equals(that.consumer_tag_prefix)) return false;
        if (!consumer_name.equals(that.consumer_name)) return false;
        return workflow_id.equals(that.workflow_id);
    }

    @Override
    public int hashCode() {
        int result = pre_fetch_count;
        result = 31 * result + consumer_tag_prefix.hashCode();
        result = 31 * result + consumer_name.hashCode();
        result = 31 * result + workflow_id.hashCode();
        result = 31 * result + (requeue_on_nack ? 1 : 0);
        result = 31 * result + (int) (drain_poll_interval_millis ^ (drain_poll_interval_millis >>> 32));
        result = 31 * result + drain_max_polls;
        result = 31 * result + drain_progress_log_polls;
        result = 31 * result + (int) (unacked_warning_millis ^ (unacked_warning_millis >>> 32));
        return result;
    }
}
