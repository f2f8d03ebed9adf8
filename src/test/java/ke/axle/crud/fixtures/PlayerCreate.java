package ke.axle.crud.fixtures;

public class PlayerCreate {

    private String name;
    private String teamId;
    private Integer score;

    public PlayerCreate() {
    }

    public PlayerCreate(String name) {
        this.name = name;
    }

    public PlayerCreate(String name, String teamId, Integer score) {
        this.name = name;
        this.teamId = teamId;
        this.score = score;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTeamId() {
        return teamId;
    }

    public void setTeamId(String teamId) {
        this.teamId = teamId;
    }

    public Integer getScore() {
        return score;
    }

    public void setScore(Integer score) {
        this.score = score;
    }
}
