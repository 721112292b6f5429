package io.github.hotbrkm.autobulk.dispatcher.worker;

import lombok.experimental.UtilityClass;

import java.net.InetAddress;
import java.net.UnknownHostException;

@UtilityClass
class WorkerIdentity {

    private static volatile String defaultWorkerId;

    /**
     * {@code host:pid} of this process, resolved once.
     */
    static String defaultWorkerId() {
        String cached = defaultWorkerId;
        if (cached != null) {
            return cached;
        }
        synchronized (WorkerIdentity.class) {
            if (defaultWorkerId == null) {
                defaultWorkerId = hostName() + ":" + ProcessHandle.current().pid();
            }
            return defaultWorkerId;
        }
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
