package com.company.guardian.alerting;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Remediation hints for common failure reasons and exit codes.
 */
public final class SuggestedFixes {

    static final String DEFAULT_FIX = "Check job logs and events for details.";

    private static final Map<String, String> BY_REASON = new LinkedHashMap<>();
    private static final Map<Integer, String> BY_EXIT_CODE = new LinkedHashMap<>();

    static {
        BY_REASON.put("oomkilled", "Container ran out of memory. Increase the memory limit.");
        BY_REASON.put("imagepullbackoff", "Failed to pull image. Check image name/tag and registry credentials.");
        BY_REASON.put("crashloopbackoff", "Container keeps crashing. Check application logs for startup errors.");
        BY_REASON.put("createcontainerconfigerror", "Config error. Check that referenced secrets and config maps exist.");
        BY_REASON.put("deadlineexceeded", "Run exceeded its deadline. The job may be too slow or the deadline too aggressive.");
        BY_REASON.put("backofflimitexceeded", "Run failed too many times. Check the underlying failure cause.");
        BY_REASON.put("evicted", "Run was evicted. Check node resources and priority.");

        BY_EXIT_CODE.put(137, "Process was killed (SIGKILL), often out of memory. Check memory limits.");
        BY_EXIT_CODE.put(143, "Process was terminated (SIGTERM). Check for preemption or shutdown during the run.");
        BY_EXIT_CODE.put(126, "Command not executable. Check the entrypoint and file permissions.");
        BY_EXIT_CODE.put(127, "Command not found. Check the entrypoint and image contents.");
    }

    private SuggestedFixes() {
    }

    public static String forFailure(Integer exitCode, String reason) {
        if (reason != null) {
            String fix = BY_REASON.get(reason.trim().toLowerCase(Locale.ROOT));
            if (fix != null) {
                return fix;
            }
        }
        if (exitCode != null && BY_EXIT_CODE.containsKey(exitCode)) {
            return BY_EXIT_CODE.get(exitCode);
        }
        return DEFAULT_FIX;
    }
}
