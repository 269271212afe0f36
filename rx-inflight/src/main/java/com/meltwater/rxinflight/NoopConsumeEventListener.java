package com.meltwater.rxinflight;

public class NoopConsumeEventListener implements ConsumeEventListener {

    @Override
    public String toString() {
        return "NoopConsumeEventListener";
    }
}
