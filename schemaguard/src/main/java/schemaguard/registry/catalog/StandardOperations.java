package schemaguard.registry.catalog;

import schemaguard.registry.OperationSpec;
import schemaguard.validation.PathSafetyPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Every operation the application may run, grouped by domain.
 */
public final class StandardOperations {

    private StandardOperations() {
    }

    /**
     * @param paths policy applied to operations that store file paths
     * @return the operations of all domains
     */
    public static List<OperationSpec> all(PathSafetyPolicy paths) {
        List<DomainOperations> domains = List.of(
                new EquipmentOperations(),
                new InspectionOperations(),
                new DocumentOperations(paths),
                new ScheduledInspectionOperations(),
                new ComplianceOperations(),
                new TemplateOperations(),
                new InspectionItemOperations(),
                new DeficiencyOperations(),
                new SignatureOperations(),
                new WorkOrderOperations(),
                new PmTemplateOperations(),
                new PmScheduleOperations(),
                new LoadTestOperations(),
                new CalibrationOperations(),
                new CredentialOperations(),
                new UserOperations(),
                new AuditLogOperations(),
                new CertificateOperations(),
                new MeterReadingOperations(),
                new TemplateItemOperations());
        List<OperationSpec> all = new ArrayList<>();
        for (DomainOperations d : domains) {
            all.addAll(d.specs());
        }
        return List.copyOf(all);
    }
}
