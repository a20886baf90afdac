package com.apogee.service.queue;

/** Worker queues of the pipeline and the job function each one runs. */
public enum PipelineStage {
    MINE_TOPICS("topic_miner", "mine_topics"),
    RESEARCH_TOPIC("researcher", "research_topic"),
    WRITE_SCRIPT("scriptwriter", "write_script"),
    CHECK_SCRIPT("fact_checker", "check_script");

    private final String queueName;
    private final String jobFunction;

    PipelineStage(String queueName, String jobFunction) {
        this.queueName = queueName;
        this.jobFunction = jobFunction;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getJobFunction() {
        return jobFunction;
    }
}
