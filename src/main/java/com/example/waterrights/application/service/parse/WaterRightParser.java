package com.example.waterrights.application.service.parse;

import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.domain.model.report.GroupedRecord;
import org.springframework.stereotype.Component;

/**
 * Populates a {@link WaterRight} from a segmented report. Any unknown key or malformed value fails the whole report.
 */
@Component
public class WaterRightParser {

    private final RootSectionParser rootSectionParser;
    private final DepartmentSectionParser departmentSectionParser;

    public WaterRightParser(RootSectionParser rootSectionParser, DepartmentSectionParser departmentSectionParser) {
        this.rootSectionParser = rootSectionParser;
        this.departmentSectionParser = departmentSectionParser;
    }

    public static WaterRightParser create() {
        return new WaterRightParser(
                new RootSectionParser(),
                new DepartmentSectionParser(new UsageLocationParser(new AllowanceValueParser())));
    }

    /**
     * @param waterRightNo number the report belongs to
     * @param record       segmented report
     * @return parsed water right before post-processing
     */
    public WaterRight parse(long waterRightNo, GroupedRecord record) {
        WaterRight waterRight = new WaterRight(waterRightNo);
        waterRight.setAnnotation(record.annotation());
        rootSectionParser.parse(record.root(), waterRight);
        departmentSectionParser.parse(record.departments(), waterRight);
        return waterRight;
    }
}
