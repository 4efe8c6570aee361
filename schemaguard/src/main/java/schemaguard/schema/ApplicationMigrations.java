package schemaguard.schema;

import schemaguard.plan.MigrationPlan;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema history of the inspection database.
 *
 * <ul>
 *   <li>1: equipment, inspections, documents, schedules, compliance standards, templates</li>
 *   <li>2: inspection checklist items, deficiencies, signatures; document integrity columns</li>
 *   <li>3: work orders, preventive maintenance, meter readings; equipment hierarchy and lock-out</li>
 *   <li>4: load tests, calibrations, credentials, template items</li>
 *   <li>5: users, audit log, certificates</li>
 * </ul>
 *
 * <p>Statements use {@code IF NOT EXISTS} so a step can be re-run against a database that
 * already has part of it.
 */
public final class ApplicationMigrations {

    public static final int TARGET_VERSION = 5;

    private static final String ID = "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";

    private ApplicationMigrations() {
    }

    /**
     * @return the plan holding every version up to {@link #TARGET_VERSION}
     */
    public static MigrationPlan plan() {
        return MigrationPlan.builder()
                .step(1, "baseline schema", ApplicationMigrations::baseline)
                .step(2, "inspection items, deficiencies and signatures", ApplicationMigrations::inspectionDetail)
                .step(3, "work orders and preventive maintenance", ApplicationMigrations::maintenance)
                .step(4, "load tests, calibrations, credentials and template items", ApplicationMigrations::testing)
                .step(5, "users, audit log and certificates", ApplicationMigrations::accountability)
                .build();
    }

    static void baseline(Connection c) throws SQLException {
        execute(c,
                "CREATE TABLE IF NOT EXISTS equipment ("
                        + ID + ", "
                        + "equipment_id VARCHAR(255) UNIQUE, "
                        + "type VARCHAR(255), "
                        + "manufacturer VARCHAR(255), "
                        + "model VARCHAR(255), "
                        + "serial_number VARCHAR(255), "
                        + "capacity DOUBLE PRECISION, "
                        + "installation_date DATE, "
                        + "location VARCHAR(255), "
                        + "status VARCHAR(50), "
                        + "qr_code_data VARCHAR)",

                "CREATE TABLE IF NOT EXISTS inspections ("
                        + ID + ", "
                        + "equipment_id BIGINT REFERENCES equipment (id), "
                        + "inspector VARCHAR(255), "
                        + "inspection_date DATE, "
                        + "findings VARCHAR, "
                        + "corrective_actions VARCHAR)",

                "CREATE TABLE IF NOT EXISTS documents ("
                        + ID + ", "
                        + "equipment_id BIGINT REFERENCES equipment (id), "
                        + "file_name VARCHAR(255), "
                        + "file_path VARCHAR(4096))",

                "CREATE TABLE IF NOT EXISTS scheduled_inspections ("
                        + ID + ", "
                        + "equipment_id BIGINT REFERENCES equipment (id), "
                        + "scheduled_date DATE, "
                        + "assigned_inspector VARCHAR(255), "
                        + "status VARCHAR(20) DEFAULT 'scheduled')",

                "CREATE TABLE IF NOT EXISTS compliance_standards ("
                        + ID + ", "
                        + "name VARCHAR(255), "
                        + "description VARCHAR, "
                        + "authority VARCHAR(255))",

                "CREATE TABLE IF NOT EXISTS equipment_type_compliance ("
                        + "equipment_type VARCHAR(255) NOT NULL, "
                        + "standard_id BIGINT NOT NULL REFERENCES compliance_standards (id) ON DELETE CASCADE, "
                        + "PRIMARY KEY (equipment_type, standard_id))",

                "CREATE TABLE IF NOT EXISTS inspection_templates ("
                        + ID + ", "
                        + "name VARCHAR(255) UNIQUE, "
                        + "fields VARCHAR)",

                "CREATE INDEX IF NOT EXISTS idx_inspections_equipment_id ON inspections (equipment_id)",
                "CREATE INDEX IF NOT EXISTS idx_inspections_date ON inspections (inspection_date)",
                "CREATE INDEX IF NOT EXISTS idx_documents_equipment_id ON documents (equipment_id)",
                "CREATE INDEX IF NOT EXISTS idx_scheduled_inspections_equipment_id ON scheduled_inspections (equipment_id)");
    }

    static void inspectionDetail(Connection c) throws SQLException {
        execute(c,
                "ALTER TABLE inspections ADD COLUMN IF NOT EXISTS summary_comments VARCHAR",
                "ALTER TABLE inspections ADD COLUMN IF NOT EXISTS signature VARCHAR",
                "ALTER TABLE inspections ADD COLUMN IF NOT EXISTS scheduled_inspection_id BIGINT",
                "ALTER TABLE inspections ADD COLUMN IF NOT EXISTS inspection_date_date DATE",
                "ALTER TABLE inspections ADD CONSTRAINT IF NOT EXISTS fk_inspections_scheduled "
                        + "FOREIGN KEY (scheduled_inspection_id) REFERENCES scheduled_inspections (id) ON DELETE SET NULL",
                "UPDATE inspections SET inspection_date_date = inspection_date WHERE inspection_date_date IS NULL",
                "CREATE INDEX IF NOT EXISTS idx_inspections_date_date ON inspections (inspection_date_date)",
                "CREATE INDEX IF NOT EXISTS idx_inspections_scheduled ON inspections (scheduled_inspection_id)",

                "ALTER TABLE documents ADD COLUMN IF NOT EXISTS hash VARCHAR(128)",
                "ALTER TABLE documents ADD COLUMN IF NOT EXISTS size BIGINT",
                "ALTER TABLE documents ADD COLUMN IF NOT EXISTS uploaded_by VARCHAR(255)",
                "ALTER TABLE documents ADD COLUMN IF NOT EXISTS uploaded_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP",

                "CREATE TABLE IF NOT EXISTS inspection_items ("
                        + ID + ", "
                        + "inspection_id BIGINT NOT NULL REFERENCES inspections (id) ON DELETE CASCADE, "
                        + "standard_ref VARCHAR(255), "
                        + "item_text VARCHAR NOT NULL, "
                        + "critical BOOLEAN DEFAULT FALSE, "
                        + "result VARCHAR(10) CHECK (result IN ('pass', 'fail', 'na')), "
                        + "notes VARCHAR, "
                        + "photos VARCHAR, "
                        + "component VARCHAR(255), "
                        + "priority VARCHAR(20), "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS deficiencies ("
                        + ID + ", "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id), "
                        + "inspection_item_id BIGINT REFERENCES inspection_items (id) ON DELETE SET NULL, "
                        + "severity VARCHAR(20) NOT NULL CHECK (severity IN ('critical', 'major', 'minor')), "
                        + "remove_from_service BOOLEAN DEFAULT FALSE, "
                        + "description VARCHAR NOT NULL, "
                        + "component VARCHAR(255), "
                        + "corrective_action VARCHAR, "
                        + "due_date DATE, "
                        + "status VARCHAR(20) DEFAULT 'open' NOT NULL "
                        + "CHECK (status IN ('open', 'in_progress', 'verified', 'closed')), "
                        + "verification_signature VARCHAR, "
                        + "verification_timestamp TIMESTAMP, "
                        + "closed_at TIMESTAMP, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                        + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS signatures ("
                        + ID + ", "
                        + "entity_type VARCHAR(20) NOT NULL CHECK (entity_type IN ('inspection', 'deficiency', 'work_order')), "
                        + "entity_id BIGINT NOT NULL, "
                        + "signature_type VARCHAR(20) NOT NULL "
                        + "CHECK (signature_type IN ('inspector', 'supervisor', 'verification')), "
                        + "signatory_name VARCHAR(255) NOT NULL, "
                        + "signature_data VARCHAR NOT NULL, "
                        + "signed_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE INDEX IF NOT EXISTS idx_inspection_items_inspection ON inspection_items (inspection_id)",
                "CREATE INDEX IF NOT EXISTS idx_deficiencies_equipment ON deficiencies (equipment_id)",
                "CREATE INDEX IF NOT EXISTS idx_deficiencies_status ON deficiencies (status)",
                "CREATE INDEX IF NOT EXISTS idx_signatures_entity ON signatures (entity_type, entity_id)");
    }

    static void maintenance(Connection c) throws SQLException {
        execute(c,
                "ALTER TABLE equipment ADD COLUMN IF NOT EXISTS parent_id BIGINT",
                "ALTER TABLE equipment ADD COLUMN IF NOT EXISTS site VARCHAR(255)",
                "ALTER TABLE equipment ADD COLUMN IF NOT EXISTS building VARCHAR(255)",
                "ALTER TABLE equipment ADD COLUMN IF NOT EXISTS bay VARCHAR(255)",
                "ALTER TABLE equipment ADD COLUMN IF NOT EXISTS tagged_out BOOLEAN DEFAULT FALSE",
                "ALTER TABLE equipment ADD CONSTRAINT IF NOT EXISTS fk_equipment_parent "
                        + "FOREIGN KEY (parent_id) REFERENCES equipment (id) ON DELETE SET NULL",

                "CREATE TABLE IF NOT EXISTS work_orders ("
                        + ID + ", "
                        + "wo_number VARCHAR(50) NOT NULL UNIQUE, "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id), "
                        + "deficiency_id BIGINT REFERENCES deficiencies (id) ON DELETE SET NULL, "
                        + "title VARCHAR(255) NOT NULL, "
                        + "description VARCHAR, "
                        + "work_type VARCHAR(20) CHECK (work_type IN ('preventive', 'corrective', 'emergency', 'project')), "
                        + "priority VARCHAR(20) CHECK (priority IN ('low', 'medium', 'high', 'critical')), "
                        + "status VARCHAR(20) DEFAULT 'draft' NOT NULL, "
                        + "assigned_to VARCHAR(255), "
                        + "estimated_hours DOUBLE PRECISION, "
                        + "actual_hours DOUBLE PRECISION, "
                        + "parts_cost DOUBLE PRECISION, "
                        + "labor_cost DOUBLE PRECISION, "
                        + "completion_notes VARCHAR, "
                        + "created_by VARCHAR(255) NOT NULL, "
                        + "scheduled_date DATE, "
                        + "started_at TIMESTAMP, "
                        + "completed_at TIMESTAMP, "
                        + "closed_at TIMESTAMP, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "ALTER TABLE deficiencies ADD COLUMN IF NOT EXISTS work_order_id BIGINT",
                "ALTER TABLE deficiencies ADD CONSTRAINT IF NOT EXISTS fk_deficiencies_work_order "
                        + "FOREIGN KEY (work_order_id) REFERENCES work_orders (id) ON DELETE SET NULL",

                "CREATE TABLE IF NOT EXISTS pm_templates ("
                        + ID + ", "
                        + "name VARCHAR(255) NOT NULL, "
                        + "equipment_type VARCHAR(255) NOT NULL, "
                        + "description VARCHAR, "
                        + "frequency_type VARCHAR(20) NOT NULL CHECK (frequency_type IN ('calendar', 'usage', 'condition')), "
                        + "frequency_value INT NOT NULL CHECK (frequency_value > 0), "
                        + "frequency_unit VARCHAR(20), "
                        + "estimated_duration DOUBLE PRECISION, "
                        + "instructions VARCHAR, "
                        + "required_skills VARCHAR, "
                        + "required_parts VARCHAR, "
                        + "safety_notes VARCHAR, "
                        + "active BOOLEAN DEFAULT TRUE NOT NULL, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                        + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS pm_schedules ("
                        + ID + ", "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id) ON DELETE CASCADE, "
                        + "pm_template_id BIGINT NOT NULL REFERENCES pm_templates (id), "
                        + "next_due_date DATE, "
                        + "next_due_usage DOUBLE PRECISION, "
                        + "last_completed_date DATE, "
                        + "last_completed_usage DOUBLE PRECISION, "
                        + "active BOOLEAN DEFAULT TRUE NOT NULL, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS meter_readings ("
                        + ID + ", "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id) ON DELETE CASCADE, "
                        + "meter_type VARCHAR(50) NOT NULL, "
                        + "reading_value DOUBLE PRECISION NOT NULL, "
                        + "reading_date DATE NOT NULL, "
                        + "recorded_by VARCHAR(255) NOT NULL, "
                        + "notes VARCHAR, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE INDEX IF NOT EXISTS idx_work_orders_equipment ON work_orders (equipment_id)",
                "CREATE INDEX IF NOT EXISTS idx_work_orders_status ON work_orders (status)",
                "CREATE INDEX IF NOT EXISTS idx_pm_schedules_due ON pm_schedules (next_due_date)",
                "CREATE INDEX IF NOT EXISTS idx_meter_readings_equipment ON meter_readings (equipment_id, meter_type)");
    }

    static void testing(Connection c) throws SQLException {
        execute(c,
                "CREATE TABLE IF NOT EXISTS load_tests ("
                        + ID + ", "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id), "
                        + "test_date DATE NOT NULL, "
                        + "test_type VARCHAR(20) NOT NULL "
                        + "CHECK (test_type IN ('annual', 'periodic', 'initial', 'after_repair')), "
                        + "test_load_percentage DOUBLE PRECISION, "
                        + "rated_capacity DOUBLE PRECISION, "
                        + "test_load DOUBLE PRECISION, "
                        + "test_duration DOUBLE PRECISION, "
                        + "inspector VARCHAR(255) NOT NULL, "
                        + "test_results VARCHAR(10) NOT NULL CHECK (test_results IN ('pass', 'fail')), "
                        + "deficiencies_found VARCHAR, "
                        + "corrective_actions VARCHAR, "
                        + "next_test_due DATE, "
                        + "certificate_number VARCHAR(100), "
                        + "notes VARCHAR, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS calibrations ("
                        + ID + ", "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id), "
                        + "instrument_type VARCHAR(255) NOT NULL, "
                        + "calibration_date DATE NOT NULL, "
                        + "calibration_due_date DATE NOT NULL, "
                        + "calibrated_by VARCHAR(255) NOT NULL, "
                        + "calibration_agency VARCHAR(255), "
                        + "certificate_number VARCHAR(100), "
                        + "calibration_results VARCHAR(10) NOT NULL "
                        + "CHECK (calibration_results IN ('pass', 'fail', 'limited')), "
                        + "accuracy_tolerance VARCHAR(100), "
                        + "actual_accuracy VARCHAR(100), "
                        + "adjustments_made VARCHAR, "
                        + "notes VARCHAR, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS credentials ("
                        + ID + ", "
                        + "person_name VARCHAR(255) NOT NULL, "
                        + "credential_type VARCHAR(255) NOT NULL, "
                        + "equipment_types VARCHAR, "
                        + "certification_body VARCHAR(255), "
                        + "certificate_number VARCHAR(100), "
                        + "issue_date DATE NOT NULL, "
                        + "expiration_date DATE NOT NULL, "
                        + "renewal_required BOOLEAN DEFAULT TRUE, "
                        + "status VARCHAR(20) DEFAULT 'active' NOT NULL "
                        + "CHECK (status IN ('active', 'expired', 'suspended', 'revoked')), "
                        + "notes VARCHAR, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                        + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS template_items ("
                        + ID + ", "
                        + "template_id BIGINT NOT NULL REFERENCES inspection_templates (id) ON DELETE CASCADE, "
                        + "standard_id BIGINT REFERENCES compliance_standards (id) ON DELETE SET NULL, "
                        + "item_order INT NOT NULL, "
                        + "standard_ref VARCHAR(255), "
                        + "item_text VARCHAR NOT NULL, "
                        + "critical BOOLEAN DEFAULT FALSE, "
                        + "component VARCHAR(255), "
                        + "inspection_method VARCHAR, "
                        + "acceptance_criteria VARCHAR, "
                        + "notes VARCHAR, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE INDEX IF NOT EXISTS idx_load_tests_equipment ON load_tests (equipment_id)",
                "CREATE INDEX IF NOT EXISTS idx_calibrations_equipment ON calibrations (equipment_id)",
                "CREATE INDEX IF NOT EXISTS idx_credentials_person ON credentials (person_name)",
                "CREATE INDEX IF NOT EXISTS idx_template_items_template ON template_items (template_id, item_order)");
    }

    static void accountability(Connection c) throws SQLException {
        execute(c,
                "CREATE TABLE IF NOT EXISTS users ("
                        + ID + ", "
                        + "username VARCHAR(100) NOT NULL UNIQUE, "
                        + "full_name VARCHAR(255) NOT NULL, "
                        + "email VARCHAR(255), "
                        + "role VARCHAR(20) NOT NULL CHECK (role IN ('admin', 'inspector', 'reviewer', 'viewer')), "
                        + "active BOOLEAN DEFAULT TRUE NOT NULL, "
                        + "last_login TIMESTAMP, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS audit_log ("
                        + ID + ", "
                        + "user_id BIGINT REFERENCES users (id) ON DELETE SET NULL, "
                        + "username VARCHAR(100) NOT NULL, "
                        + "action VARCHAR(50) NOT NULL, "
                        + "entity_type VARCHAR(50) NOT NULL, "
                        + "entity_id BIGINT NOT NULL, "
                        + "old_values VARCHAR, "
                        + "new_values VARCHAR, "
                        + "ip_address VARCHAR(64), "
                        + "user_agent VARCHAR, "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE TABLE IF NOT EXISTS certificates ("
                        + ID + ", "
                        + "certificate_number VARCHAR(100) NOT NULL UNIQUE, "
                        + "certificate_type VARCHAR(20) NOT NULL "
                        + "CHECK (certificate_type IN ('inspection', 'load_test', 'calibration')), "
                        + "equipment_id BIGINT NOT NULL REFERENCES equipment (id), "
                        + "entity_id BIGINT NOT NULL, "
                        + "issue_date DATE NOT NULL, "
                        + "expiration_date DATE, "
                        + "issued_by VARCHAR(255) NOT NULL, "
                        + "qr_code_data VARCHAR, "
                        + "certificate_hash VARCHAR(128), "
                        + "status VARCHAR(20) DEFAULT 'active' NOT NULL "
                        + "CHECK (status IN ('active', 'expired', 'revoked')), "
                        + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",

                "CREATE INDEX IF NOT EXISTS idx_audit_log_entity ON audit_log (entity_type, entity_id)",
                "CREATE INDEX IF NOT EXISTS idx_certificates_equipment ON certificates (equipment_id)");
    }

    private static void execute(Connection c, String... statements) throws SQLException {
        try (Statement st = c.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
    }
}
