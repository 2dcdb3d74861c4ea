package io.cryojob4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Site configuration for command compilation.
 */
@ConfigurationProperties(prefix = "cryojob")
public class CompilerProperties {
    private String projectsRoot = "/data/projects";
    private boolean submitToQueue = true; // used when the request carries no submitToQueue
    private String mpiLauncher = "mpirun";
    private String mpiProcsFlag = "-np";
    private String ctffindExecutable = "ctffind";
    private String gctfExecutable = "gctf";
    private String motioncor2Executable = "";
    private String dynamightExecutable = "relion_python_dynamight";
    private int thumbnailSize = 512;

    public String getProjectsRoot() {
        return projectsRoot;
    }

    public void setProjectsRoot(String projectsRoot) {
        this.projectsRoot = projectsRoot;
    }

    public boolean isSubmitToQueue() {
        return submitToQueue;
    }

    public void setSubmitToQueue(boolean submitToQueue) {
        this.submitToQueue = submitToQueue;
    }

    public String getMpiLauncher() {
        return mpiLauncher;
    }

    public void setMpiLauncher(String mpiLauncher) {
        this.mpiLauncher = mpiLauncher;
    }

    public String getMpiProcsFlag() {
        return mpiProcsFlag;
    }

    public void setMpiProcsFlag(String mpiProcsFlag) {
        this.mpiProcsFlag = mpiProcsFlag;
    }

    public String getCtffindExecutable() {
        return ctffindExecutable;
    }

    public void setCtffindExecutable(String ctffindExecutable) {
        this.ctffindExecutable = ctffindExecutable;
    }

    public String getGctfExecutable() {
        return gctfExecutable;
    }

    public void setGctfExecutable(String gctfExecutable) {
        this.gctfExecutable = gctfExecutable;
    }

    public String getMotioncor2Executable() {
        return motioncor2Executable;
    }

    public void setMotioncor2Executable(String motioncor2Executable) {
        this.motioncor2Executable = motioncor2Executable;
    }

    public String getDynamightExecutable() {
        return dynamightExecutable;
    }

    public void setDynamightExecutable(String dynamightExecutable) {
        this.dynamightExecutable = dynamightExecutable;
    }

    public int getThumbnailSize() {
        return thumbnailSize;
    }

    public void setThumbnailSize(int thumbnailSize) {
        this.thumbnailSize = thumbnailSize;
    }
}
