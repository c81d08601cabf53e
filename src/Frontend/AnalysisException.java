package Frontend;

import Frontend.Detector.DetectionResult;

/**
 * 分析请求无法执行：源码为空，或者无法识别语言
 */
public class AnalysisException extends Exception {
    private final transient DetectionResult detection;

    public AnalysisException(String message) {
        this(message, null);
    }

    public AnalysisException(String message, DetectionResult detection) {
        super(message);
        this.detection = detection;
    }

    /**
     * 识别失败时附带各语言得分，其余情况为 null
     */
    public DetectionResult getDetection() {
        return detection;
    }
}
