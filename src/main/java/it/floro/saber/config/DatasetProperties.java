package it.floro.saber.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Dimensioni del dataset simulato ({@code saber.data.*}).
 */
@ConfigurationProperties(prefix = "saber.data")
public class DatasetProperties {

    private long seed = 42L;
    private int schools = 240;
    private int studentsPerSchool = 30;
    private List<Integer> years = new ArrayList<>(List.of(2023, 2024));

    public long getSeed() { return seed; }
    public void setSeed(long seed) { this.seed = seed; }

    public int getSchools() { return schools; }
    public void setSchools(int schools) { this.schools = schools; }

    public int getStudentsPerSchool() { return studentsPerSchool; }
    public void setStudentsPerSchool(int studentsPerSchool) { this.studentsPerSchool = studentsPerSchool; }

    public List<Integer> getYears() { return years; }
    public void setYears(List<Integer> years) { this.years = years; }
}
